package com.track.resolution.guard;

/**
 * Outcome of a guard: pass, or a veto naming the guard and the reason.
 */
public record GuardResult(boolean passed, String guardName, String reason) {

    private static final GuardResult PASS = new GuardResult(true, null, null);

    public static GuardResult pass() {
        return PASS;
    }

    public static GuardResult veto(String guardName, String reason) {
        return new GuardResult(false, guardName, reason);
    }

    public boolean vetoed() {
        return !passed;
    }

    /**
     * "guard_name: reason" for vetoes, "pass" otherwise.
     */
    public String describe() {
        return passed ? "pass" : guardName + ": " + reason;
    }
}
