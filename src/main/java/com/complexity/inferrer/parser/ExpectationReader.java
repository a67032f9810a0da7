package com.complexity.inferrer.parser;

import com.complexity.inferrer.annotations.Complexity;
import com.complexity.inferrer.model.ComplexityExpectation;
import com.complexity.inferrer.model.ComplexityLabel;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;

import java.util.Optional;

/**
 * Reads the {@link Complexity} declaration of a Java snippet. The first
 * annotated method or constructor in source order wins.
 */
public class ExpectationReader {

    private static final String ANNOTATION_NAME = Complexity.class.getSimpleName();

    public Optional<ComplexityExpectation> read(Node root) {
        for (AnnotationExpr annotation : root.findAll(AnnotationExpr.class)) {
            if (!getSimpleAnnotationName(annotation).equals(ANNOTATION_NAME)) {
                continue;
            }
            Optional<String> declaredOn = annotation.getParentNode()
                    .filter(parent -> parent instanceof CallableDeclaration)
                    .map(parent -> ((CallableDeclaration<?>) parent).getNameAsString());
            if (declaredOn.isPresent()) {
                return Optional.of(toExpectation(declaredOn.get(), annotation));
            }
        }
        return Optional.empty();
    }

    private static ComplexityExpectation toExpectation(String declaredOn, AnnotationExpr annotation) {
        ComplexityLabel time = null;
        ComplexityLabel space = null;
        if (annotation.isNormalAnnotationExpr()) {
            for (MemberValuePair pair : annotation.asNormalAnnotationExpr().getPairs()) {
                String value = stringValue(pair.getValue());
                if (value.isBlank()) {
                    continue;
                }
                if (pair.getNameAsString().equals("time")) {
                    time = ComplexityLabel.of(value);
                } else if (pair.getNameAsString().equals("space")) {
                    space = ComplexityLabel.of(value);
                }
            }
        }
        return new ComplexityExpectation(declaredOn, time, space);
    }

    private static String stringValue(Expression value) {
        if (value.isStringLiteralExpr()) {
            return value.asStringLiteralExpr().asString();
        }
        return value.toString().replace("\"", "");
    }

    private static String getSimpleAnnotationName(AnnotationExpr annotation) {
        String fullName = annotation.getNameAsString();
        int lastDot = fullName.lastIndexOf('.');
        return lastDot >= 0 ? fullName.substring(lastDot + 1) : fullName;
    }
}
