package experiment.sample_code;

import com.complexity.inferrer.annotations.Complexity;

/**
 * Trial division up to the square root.
 */
public class PrimeCheck {

    @Complexity(time = "O(√n)", space = "O(1)")
    public boolean isPrime(int n) {
        if (n < 2) {
            return false;
        }
        for (int i = 2; i * i <= n; i++) {
            if (n % i == 0) {
                return false;
            }
        }
        return true;
    }
}
