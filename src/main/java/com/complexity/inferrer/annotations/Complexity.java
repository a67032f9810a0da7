package com.complexity.inferrer.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the expected complexity of a snippet in Big-O notation, e.g.
 * {@code @Complexity(time = "O(log n)", space = "O(1)")}. The batch processor
 * compares these declarations with what it infers. An empty value means no
 * expectation for that dimension.
 */
@Retention(RetentionPolicy.SOURCE)
@Target({ElementType.METHOD, ElementType.CONSTRUCTOR})
public @interface Complexity {
    String time() default "";
    String space() default "";
}
