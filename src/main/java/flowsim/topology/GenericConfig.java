package flowsim.topology;

import java.util.Objects;

/**
 * Configuration of a node without a simulation role. Entities pass straight through.
 */
public record GenericConfig(String name) implements RoleConfig {

    public GenericConfig {
        Objects.requireNonNull(name, "Name cannot be null");
    }

    public static GenericConfig named(String name) {
        return new GenericConfig(name);
    }

    @Override
    public SimulationRole role() {
        return SimulationRole.GENERIC;
    }
}
