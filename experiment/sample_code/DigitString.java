package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

/**
 * Counts the even digits of a number by walking its decimal string.
 */
public class DigitString {

    @Complexity(time = "O(log n)", space = "O(log n)")
    public int evenDigits(int n) {
        int count = 0;
        for (char c : String.valueOf(n).toCharArray()) {
            if ((c - '0') % 2 == 0) {
                count++;
            }
        }
        return count;
    }
}
