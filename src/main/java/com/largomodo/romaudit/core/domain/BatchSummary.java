package com.largomodo.romaudit.core.domain;

/**
 * Counters of a batch verification run.
 *
 * @param complete     machines with every required part OK
 * @param fixable      machines repairable by renames and copies
 * @param incomplete   machines with content missing
 * @param unverifiable machines excluded by catalog integrity errors
 * @param failed       machines whose verification threw
 * @param skipped      machines not verified because the run was cancelled
 */
public record BatchSummary(int complete, int fixable, int incomplete, int unverifiable, int failed, int skipped) {

    public int verified() {
        return complete + fixable + incomplete + unverifiable;
    }

    public boolean allComplete() {
        return fixable == 0 && incomplete == 0 && unverifiable == 0 && failed == 0 && skipped == 0;
    }
}
