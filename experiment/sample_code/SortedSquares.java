package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

import java.util.Arrays;

/**
 * Squares every value and returns them in ascending order.
 */
public class SortedSquares {

    @Complexity(time = "O(n log n)", space = "O(n)")
    public int[] sortedSquares(int[] values) {
        int[] squares = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            squares[i] = values[i] * values[i];
        }
        Arrays.sort(squares);
        return squares;
    }
}
