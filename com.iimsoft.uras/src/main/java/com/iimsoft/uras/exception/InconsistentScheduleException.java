package com.iimsoft.uras.exception;

/**
 * 排程引用了问题中不存在的 activity / resource。出现即说明调用方有 bug。
 */
public class InconsistentScheduleException extends SchedulingException {

    public InconsistentScheduleException(String message) {
        super(ErrorKind.INCONSISTENT_SCHEDULE, message);
    }
}
