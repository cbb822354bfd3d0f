package FSA.Model;

import java.util.Objects;

/**
 * A state with a single, caller-supplied label.
 */
public record AtomicState(String label) implements State {

    public AtomicState {
        Objects.requireNonNull(label, "label");
    }

    public static AtomicState of(String label) {
        return new AtomicState(label);
    }

    @Override
    public String toString() {
        return label;
    }
}
