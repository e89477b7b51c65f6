package dev.pairreview.domain.valueobject;

/**
 * Free-text guidance for a run: repository-wide instructions and the ones given with this request.
 */
public record RunInstructions(String repoInstructions, String requestInstructions) {

    public static RunInstructions none() {
        return new RunInstructions(null, null);
    }

    public boolean isEmpty() {
        return isBlank(repoInstructions) && isBlank(requestInstructions);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
