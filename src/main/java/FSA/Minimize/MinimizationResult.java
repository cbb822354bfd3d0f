package FSA.Minimize;

import java.util.List;

import FSA.Model.Automaton;

/**
 * @param minimized the minimized DFA
 * @param steps     partitions P0..Pk; the last one equals its predecessor
 */
public record MinimizationResult(Automaton minimized, List<RefinementStep> steps) {

    public MinimizationResult {
        steps = List.copyOf(steps);
    }

    public Partition finalPartition() {
        return steps.get(steps.size() - 1).partition();
    }

    /**
     * @return number of rounds after P0 that increased the number of groups
     */
    public int splits() {
        int splits = 0;
        for (int i = 1; i < steps.size(); i++) {
            if (steps.get(i).partition().groupCount() > steps.get(i - 1).partition().groupCount()) {
                splits++;
            }
        }
        return splits;
    }
}
