package dev.leaddispatch.model;

/**
 * Three-part outcome of a batch operation (collect, import).
 *
 * @param succeeded  rows written
 * @param duplicates rows skipped because they already existed
 * @param errors     rows rejected by validation or failed writes
 */
public record BatchSummary(int succeeded, int duplicates, int errors) {

    public static final BatchSummary EMPTY = new BatchSummary(0, 0, 0);

    public int total() {
        return succeeded + duplicates + errors;
    }

    public String describe() {
        return String.format("%d succeeded, %d skipped (duplicate), %d errors", succeeded, duplicates, errors);
    }
}
