package io.vectorvault.catalog;

/**
 * Field checks shared by the descriptor records.
 */
final class Descriptors {

    private Descriptors() {
    }

    static void requireModel(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName cannot be blank");
        }
    }

    static void requirePositive(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0, got " + dimension);
        }
    }
}
