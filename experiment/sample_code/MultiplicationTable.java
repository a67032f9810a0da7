package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

/**
 * Prints the first ten multiples of a number, one recursive call per row.
 */
public class MultiplicationTable {

    public void table(int n) {
        table(n, 1);
    }

    @Complexity(time = "O(1)", space = "O(1)")
    public void table(int n, int i) {
        if (i > 10) {
            return;
        }
        System.out.println(n + " x " + i + " = " + (n * i));
        table(n, i + 1);
    }
}
