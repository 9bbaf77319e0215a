package flowsim.topology;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Probabilistic branching node. Branches are matched to outgoing edges by position;
 * the probabilities are expected to sum to 1.0.
 */
public record ChanceConfig(String name, List<ChanceBranch> branches) implements RoleConfig {

    public ChanceConfig {
        Objects.requireNonNull(name, "Chance name cannot be null");
        Objects.requireNonNull(branches, "Branches cannot be null");
        branches = List.copyOf(branches);
    }

    /**
     * Creates a chance node with unlabelled branches, labelled by position.
     */
    public static ChanceConfig withProbabilities(String name, double... probabilities) {
        ChanceBranch[] branches = new ChanceBranch[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            branches[i] = ChanceBranch.of("branch-" + i, probabilities[i]);
        }
        return new ChanceConfig(name, Arrays.asList(branches));
    }

    @Override
    public SimulationRole role() {
        return SimulationRole.CHANCE;
    }
}
