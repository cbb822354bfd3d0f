package FSA.Minimize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import FSA.Model.State;

/**
 * One round of Moore's algorithm: the partition it produced and the signature of every state.
 * Round 0 is the accepting/non-accepting split.
 */
public record RefinementStep(int round, Partition partition, Map<State, Signature> signatures) {

    public RefinementStep {
        signatures = Collections.unmodifiableMap(new LinkedHashMap<>(signatures));
    }

    public Signature signatureOf(State state) {
        return signatures.get(state);
    }

    @Override
    public String toString() {
        return "P" + round + ": " + partition;
    }
}
