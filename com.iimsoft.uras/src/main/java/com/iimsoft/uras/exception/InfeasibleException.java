package com.iimsoft.uras.exception;

/**
 * 仅用于 "要么给我排程，要么抛异常" 的调用方式；求解器本身把不可行作为普通返回值。
 */
public class InfeasibleException extends SchedulingException {

    public InfeasibleException(String message) {
        super(ErrorKind.INFEASIBLE, message);
    }
}
