package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public record OperatorTree(OperatorType type) implements Tree {

    public static OperatorTree of(OperatorType type) {
        return new OperatorTree(type);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return List.of();
    }

    public enum OperatorType {
        // Arithmetic operators
        ADD("+"),
        SUB("-"),
        MULT("*"),
        MAT_MULT("@"),
        DIV("/"),
        FLOOR_DIV("//"),
        MOD("%"),
        POW("**"),

        // Bitwise operators
        L_SHIFT("<<"),
        R_SHIFT(">>"),
        BIT_OR("|"),
        BIT_XOR("^"),
        BIT_AND("&");

        private final String value;

        OperatorType(String value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return this.value;
        }
    }
}
