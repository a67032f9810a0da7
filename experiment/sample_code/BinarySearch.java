package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

/**
 * Iterative binary search over a sorted array.
 */
public class BinarySearch {

    @Complexity(time = "O(log n)", space = "O(1)")
    public int indexOf(int[] sorted, int target) {
        int lo = 0;
        int hi = sorted.length - 1;
        while (lo <= hi) {
            int mid = (lo + hi) / 2;
            if (sorted[mid] == target) {
                return mid;
            } else if (sorted[mid] < target) {
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return -1;
    }
}
