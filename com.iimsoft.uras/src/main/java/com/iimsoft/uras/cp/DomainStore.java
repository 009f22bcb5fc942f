package com.iimsoft.uras.cp;

import java.util.BitSet;

/**
 * 所有变量的当前域。bits[a][k] 的第 s 位表示 "活动 a 用第 k 个允许资源、在网格点 s 开始" 仍可取。
 * <p>
 * 搜索时整份复制（copy-on-branch），父节点的域永远不被修改。
 */
final class DomainStore {

    private final BitSet[][] bits;

    DomainStore(BitSet[][] bits) {
        this.bits = bits;
    }

    DomainStore copy() {
        BitSet[][] c = new BitSet[bits.length][];
        for (int a = 0; a < bits.length; a++) {
            c[a] = new BitSet[bits[a].length];
            for (int k = 0; k < bits[a].length; k++) {
                c[a][k] = (BitSet) bits[a][k].clone();
            }
        }
        return new DomainStore(c);
    }

    int activityCount() {
        return bits.length;
    }

    int resourceOptions(int a) {
        return bits[a].length;
    }

    BitSet slots(int a, int k) {
        return bits[a][k];
    }

    int size(int a) {
        int s = 0;
        for (BitSet b : bits[a]) {
            s += b.cardinality();
        }
        return s;
    }

    boolean isEmpty(int a) {
        for (BitSet b : bits[a]) {
            if (!b.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /** 域中所有值都落在同一个资源选项上时返回该 k，否则 -1 */
    int onlyOption(int a) {
        int found = -1;
        for (int k = 0; k < bits[a].length; k++) {
            if (!bits[a][k].isEmpty()) {
                if (found >= 0) {
                    return -1;
                }
                found = k;
            }
        }
        return found;
    }

    int minSlot(int a, int k) {
        return bits[a][k].nextSetBit(0);
    }

    int maxSlot(int a, int k) {
        return bits[a][k].length() - 1;
    }

    /** 仅保留 (k, slot) 一个值 */
    void fix(int a, int k, int slot) {
        for (int j = 0; j < bits[a].length; j++) {
            if (j == k) {
                boolean had = bits[a][j].get(slot);
                bits[a][j].clear();
                if (had) {
                    bits[a][j].set(slot);
                }
            } else {
                bits[a][j].clear();
            }
        }
    }

    /**
     * 清除 [from, to] 闭区间内的网格点（自动裁剪到合法范围）。
     *
     * @return 是否真的删掉了值
     */
    boolean clearRange(int a, int k, long from, long to, int slots) {
        int lo = (int) Math.max(0, from);
        int hi = (int) Math.min(slots - 1L, to);
        if (lo > hi) {
            return false;
        }
        BitSet b = bits[a][k];
        int next = b.nextSetBit(lo);
        if (next < 0 || next > hi) {
            return false;
        }
        b.clear(lo, hi + 1);
        return true;
    }

    long totalSize() {
        long s = 0;
        for (int a = 0; a < bits.length; a++) {
            s += size(a);
        }
        return s;
    }
}
