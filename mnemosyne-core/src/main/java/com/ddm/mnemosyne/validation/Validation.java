package com.ddm.mnemosyne.validation;

/**
 * 校验结果。
 *
 * @param outcome 结果类型
 * @param reason  未通过时的原因，可直接展示给操作者；通过时为 null
 * @author liyifei
 * @since 1.0
 */
public record Validation(Outcome outcome, String reason) {

    public enum Outcome {
        OK,
        VIOLATION,
        READ_ONLY
    }

    private static final Validation OK = new Validation(Outcome.OK, null);
    private static final Validation READ_ONLY = new Validation(Outcome.READ_ONLY, "Config is read-only");

    public static Validation ok() {
        return OK;
    }

    public static Validation violation(String reason) {
        return new Validation(Outcome.VIOLATION, reason);
    }

    public static Validation readOnly() {
        return READ_ONLY;
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}
