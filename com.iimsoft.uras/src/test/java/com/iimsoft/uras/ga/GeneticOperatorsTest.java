package com.iimsoft.uras.ga;

import com.iimsoft.uras.TestProblems;
import com.iimsoft.uras.domain.ProblemIndex;
import com.iimsoft.uras.score.ScheduleEvaluator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeneticOperatorsTest {

    private final ProblemIndex index = new ProblemIndex(TestProblems.threeByThree());
    private final RandomSource random = new RandomSource(11);
    private final GeneticOperators ops = new GeneticOperators(index, random);
    private final ChromosomeFactory factory = new ChromosomeFactory(index, random);

    @Test
    void poxShouldKeepChosenTasksInPlace() {
        // 活动下标：J1 = 0..2, J2 = 3..5, J3 = 6..8
        int[] p1 = {0, 3, 6, 1, 4, 7, 2, 5, 8};
        int[] p2 = {6, 7, 8, 3, 4, 5, 0, 1, 2};

        int[] child = ops.pox(p1, p2, new boolean[]{true, false, false});

        assertThat(child).containsExactly(0, 6, 7, 1, 8, 3, 2, 4, 5);
    }

    @Test
    void loxShouldKeepSegmentAndFillInOrder() {
        int[] p1 = {0, 1, 2, 3, 4, 5, 6, 7, 8};
        int[] p2 = {8, 7, 6, 5, 4, 3, 2, 1, 0};

        assertThat(ops.lox(p1, p2, 3, 5)).containsExactly(8, 7, 6, 3, 4, 5, 2, 1, 0);
        assertThat(ops.lox(p1, p2, 0, 1)).containsExactly(0, 1, 8, 7, 6, 5, 4, 3, 2);
    }

    @Test
    void crossoverAndMutationShouldKeepPermutations() {
        for (CrossoverType type : CrossoverType.values()) {
            for (int i = 0; i < 50; i++) {
                Chromosome a = factory.random();
                Chromosome b = factory.random();
                ops.crossover(a, b, type);
                ops.mutateSequence(a, MutationType.values()[i % 3], 0.3);
                ops.mutateResources(b, 0.5);

                assertPermutation(a.getSequence());
                assertPermutation(b.getSequence());
                assertResourceGenesInRange(a);
                assertResourceGenesInRange(b);
                assertThat(a.getEvaluation()).isNull();
            }
        }
    }

    @Test
    void mutationKindsShouldMoveExpectedPositions() {
        int[] swap = {0, 1, 2, 3, 4};
        GeneticOperators.apply(swap, MutationType.SWAP, 1, 3);
        assertThat(swap).containsExactly(0, 3, 2, 1, 4);

        int[] insert = {0, 1, 2, 3, 4};
        GeneticOperators.apply(insert, MutationType.INSERT, 1, 3);
        assertThat(insert).containsExactly(0, 2, 3, 1, 4);

        int[] back = {0, 1, 2, 3, 4};
        GeneticOperators.apply(back, MutationType.INSERT, 3, 0);
        assertThat(back).containsExactly(3, 0, 1, 2, 4);

        int[] invert = {0, 1, 2, 3, 4};
        GeneticOperators.apply(invert, MutationType.INVERT, 4, 1);
        assertThat(invert).containsExactly(0, 4, 3, 2, 1);
    }

    @Test
    void resourceMutationShouldAlwaysPickAnotherResource() {
        Chromosome c = factory.random();
        int[] before = c.getResource();

        ops.mutateResources(c, 1.0);

        for (int a = 0; a < before.length; a++) {
            if (index.allowed(a).length > 1) {
                assertThat(c.getResource()[a]).isNotEqualTo(before[a]);
            }
        }
    }

    @Test
    void selectionShouldFavourBetterIndividuals() {
        ScheduleDecoder decoder = new ScheduleDecoder(index, new ScheduleEvaluator(index));
        List<Chromosome> pop = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            Chromosome c = factory.random();
            decoder.evaluate(c);
            pop.add(c);
        }
        Chromosome best = pop.get(0);
        for (Chromosome c : pop) {
            if (c.score().compareTo(best.score()) > 0) {
                best = c;
            }
        }

        assertThat(ops.tournament(pop, 1000).score()).isEqualTo(best.score());
        assertThat(pop).contains(ops.roulette(pop));
    }

    @Test
    void decoderShouldRepairPrecedenceOrder() {
        ScheduleDecoder decoder = new ScheduleDecoder(index, new ScheduleEvaluator(index));
        int[] reversed = {8, 7, 6, 5, 4, 3, 2, 1, 0};

        int[] order = decoder.repairedOrder(reversed);

        assertThat(order).containsExactly(6, 7, 8, 3, 4, 5, 0, 1, 2);
        Chromosome c = new Chromosome(reversed, new int[9]);
        assertThat(decoder.evaluate(c).isFeasible()).isTrue();
        assertThat(c.getEvaluation()).isNotNull();
    }

    @Test
    void scheduleRoundTripShouldReproduceMakespan() {
        ScheduleDecoder decoder = new ScheduleDecoder(index, new ScheduleEvaluator(index));
        Chromosome c = factory.loadBalanced();
        long makespan = decoder.decode(c).getMakespanMs();

        Chromosome back = factory.fromSchedule(decoder.decode(c));

        assertThat(decoder.decode(back).getMakespanMs()).isLessThanOrEqualTo(makespan);
    }

    private static void assertPermutation(int[] seq) {
        int[] sorted = seq.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            assertThat(sorted[i]).isEqualTo(i);
        }
    }

    private void assertResourceGenesInRange(Chromosome c) {
        int[] genes = c.getResource();
        for (int a = 0; a < genes.length; a++) {
            assertThat(genes[a]).isBetween(0, index.allowed(a).length - 1);
        }
    }
}
