package FSA.Minimize;

import java.util.ArrayList;
import java.util.List;

/**
 * Why a state was placed in its group during one refinement round.
 *
 * @param group      the state's group in the previous partition; in the initial partition, 1 for accepting
 *                   states and 0 otherwise
 * @param successors per alphabet symbol (in sorted order), the previous-partition group of the successor,
 *                   or {@link #DEAD} when there is no transition or the successor cannot reach an accepting
 *                   state; empty in the initial partition
 */
public record Signature(int group, List<Integer> successors) {
    public static final int DEAD = -1;

    public Signature {
        successors = List.copyOf(successors);
    }

    @Override
    public String toString() {
        List<String> succ = new ArrayList<>(successors.size());
        for (int g : successors) {
            succ.add(g == DEAD ? "dead" : Integer.toString(g));
        }
        return "(" + group + (succ.isEmpty() ? "" : "; " + String.join(", ", succ)) + ")";
    }
}
