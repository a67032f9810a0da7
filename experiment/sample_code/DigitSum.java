package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

/**
 * Sums the decimal digits of a number.
 */
public class DigitSum {

    @Complexity(time = "O(log n)", space = "O(1)")
    public int digitSum(int n) {
        int sum = 0;
        while (n > 0) {
            sum += n % 10;
            n /= 10;
        }
        return sum;
    }
}
