package com.greenloop.orchestrator.model;

/**
 * How a remediation run ended, as exposed to operators.
 *
 *   SUCCESS - every goal met, changes published
 *   BLOCKED - a safety guard halted the loop; nothing published
 *   ABORTED - a structural error stopped the loop; nothing published
 *
 * @param code   halt reason or error kind for BLOCKED/ABORTED, null on success
 * @param detail diagnostic text: history summary, error message or publication note
 * @param passes number of passes run
 */
public record Termination(
        Status  status,
        boolean published,
        String  code,
        String  detail,
        int     passes) {

    public enum Status { SUCCESS, BLOCKED, ABORTED }

    public static Termination success(String detail, int passes) {
        return new Termination(Status.SUCCESS, true, null, detail, passes);
    }

    public static Termination blocked(String code, String diagnostic, int passes) {
        return new Termination(Status.BLOCKED, false, code, diagnostic, passes);
    }

    public static Termination aborted(String code, String reason, int passes) {
        return new Termination(Status.ABORTED, false, code, reason, passes);
    }

    public boolean isSuccess() { return status == Status.SUCCESS; }
}
