package com.abt.mixfix.syntax;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything needed to declare a kind: its name, its ordered field list and
 * any mode-specific bracketers. Field order is the textual order of the
 * notation.
 *
 * <pre>
 * KindDeclaration.builder()
 *         .name("Plus")
 *         .term("p")
 *         .literal("plus", Spelling.of("+").in(pretty, " + "))
 *         .term("q")
 *         .build();
 * </pre>
 */
@Value
@Builder
public class KindDeclaration {
    @NonNull
    String name;
    @Singular
    List<FieldSpec> fields;
    @Singular
    Map<Mode, Bracketer> bracketers;

    public static class KindDeclarationBuilder {

        public KindDeclarationBuilder term(String fieldName) {
            return field(FieldSpec.term(fieldName));
        }

        public KindDeclarationBuilder binder(String fieldName) {
            return field(FieldSpec.binder(fieldName));
        }

        public KindDeclarationBuilder binder(String fieldName, Spelling separator) {
            return field(FieldSpec.binder(fieldName, separator));
        }

        public KindDeclarationBuilder literal(String fieldName, String text) {
            return field(FieldSpec.literal(fieldName, text));
        }

        public KindDeclarationBuilder literal(String fieldName, Spelling spelling) {
            return field(FieldSpec.literal(fieldName, spelling));
        }
    }
}
