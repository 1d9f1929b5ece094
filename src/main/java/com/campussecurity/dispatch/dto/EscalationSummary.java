package com.campussecurity.dispatch.dto;

/**
 * Tally of one deadline sweep.
 *
 * @param escalated expired alerts that produced a follow-up alert
 * @param exhausted expired alerts with no further candidate
 * @param failed    alerts whose expiry threw
 */
public record EscalationSummary(int escalated, int exhausted, int failed) {

    public int total() {
        return escalated + exhausted + failed;
    }
}
