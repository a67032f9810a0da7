package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

/**
 * Recursive factorial.
 */
public class Factorial {

    @Complexity(time = "O(n)", space = "O(n)")
    public long factorial(int n) {
        if (n <= 1) {
            return 1;
        }
        return n * factorial(n - 1);
    }
}
