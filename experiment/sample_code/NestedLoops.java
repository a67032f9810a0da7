package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

/**
 * Counts pairs that add up to a target.
 */
public class NestedLoops {

    @Complexity(time = "O(n²)", space = "O(1)")
    public int countPairs(int[] values, int target) {
        int pairs = 0;
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                if (values[i] + values[j] == target) {
                    pairs++;
                }
            }
        }
        return pairs;
    }
}
