package flowsim.topology;

import java.util.Objects;

/**
 * A single output branch of a chance node.
 */
public record ChanceBranch(String label, double probability) {

    public ChanceBranch {
        Objects.requireNonNull(label, "Branch label cannot be null");
        if (Double.isNaN(probability)) {
            throw new IllegalArgumentException("Branch probability cannot be NaN");
        }
    }

    public static ChanceBranch of(String label, double probability) {
        return new ChanceBranch(label, probability);
    }
}
