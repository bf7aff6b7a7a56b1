package com.sylva.codegen.compiler;

import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.backend.BackendDescriptor;
import com.sylva.codegen.api.backend.BackendDescriptor.ControlSyntax;
import com.sylva.codegen.api.backend.BackendDescriptor.FixedPointFormat;
import com.sylva.codegen.api.backend.BackendDescriptor.Indentation;
import com.sylva.codegen.api.backend.BackendDescriptor.InputFormat;
import com.sylva.codegen.api.backend.BackendDescriptor.Operators;
import com.sylva.codegen.api.backend.TemplateSet;
import com.sylva.codegen.api.model.RawNode;

import java.util.List;
import java.util.Map;

/**
 * Backends and dumps shared by the compiler tests.
 */
public final class BackendFixtures {

    private BackendFixtures() {
    }

    /** Expression-style target: each tree yields a value that is added at the root close. */
    public static BackendDescriptor expressionDescriptor() {
        return new BackendDescriptor(
                "expr",
                ".zok",
                "//",
                new Indentation("spaces", 4),
                new FixedPointFormat("i64", "i64{sgn:${positive}, v: ${magnitude}}", "true", "false"),
                new Operators("i64_le(${lhs}, ${rhs})", "i64_add(${lhs}, ${rhs})"),
                "f[${index}]",
                new ControlSyntax(
                        List.of("${tree_result} = if ${condition} {"),
                        List.of("if ${condition}{"),
                        List.of("} else {"),
                        List.of(" }"),
                        List.of(" };", " ${accumulator} = ${add};"),
                        List.of(" ${value}"),
                        List.of(" ${accumulator} = ${add};")),
                "y",
                "x",
                new InputFormat("", "\"${sign_bit}\", \"${magnitude}\"", ", ", ""),
                List.of(),
                Map.of());
    }

    /** Statement-style target: leaves accumulate directly, blocks close by indentation. */
    public static BackendDescriptor statementDescriptor() {
        return new BackendDescriptor(
                "stmt",
                ".py",
                "#",
                new Indentation("spaces", 4),
                new FixedPointFormat("int", "${value}", "True", "False"),
                new Operators("fixed_le(${lhs}, ${rhs})", "fixed_add(${lhs}, ${rhs})"),
                "f[${index}]",
                new ControlSyntax(
                        List.of("if ${condition}:"),
                        List.of("if ${condition}:"),
                        List.of("else:"),
                        List.of(),
                        List.of(),
                        List.of("${accumulator} = ${add}"),
                        null),
                "y",
                "tree_result",
                new InputFormat("[", "${value}", ", ", "]"),
                List.of("footer"),
                Map.of());
    }

    public static Backend expressionBackend() {
        return new Backend(expressionDescriptor(), new TemplateSet(
                "// header ${num_features}",
                "    // Tree ${tree_index}\n${tree_logic}",
                "def main(private i64[${num_features}] f) -> i64 {\n${tree_code}\n    return ${accumulator};\n}"));
    }

    public static Backend statementBackend() {
        return new Backend(statementDescriptor(), new TemplateSet(
                "# header x${precision_multiplier}",
                "    # Tree ${tree_index}\n${tree_logic}",
                "def predict(f):\n    ${accumulator} = 0\n${tree_code}\n    return ${accumulator}",
                Map.of("footer", "# ${tree_count} trees, ${num_features} features")));
    }

    /** {@code feature <= threshold ? yes : no}, node ids 0, 1, 2. */
    public static List<RawNode> stump(String feature, double threshold, double yes, double no) {
        return List.of(
                RawNode.split(0, feature, threshold, 1, 2),
                RawNode.leaf(1, yes),
                RawNode.leaf(2, no));
    }

    /** A two-level tree with ids 0..6. */
    public static List<RawNode> twoLevel(String root, String left, String right) {
        return List.of(
                RawNode.split(0, root, 0.5, 1, 2),
                RawNode.split(1, left, -1.25, 3, 4),
                RawNode.split(2, right, 2.0, 5, 6),
                RawNode.leaf(3, 0.1),
                RawNode.leaf(4, -0.2),
                RawNode.leaf(5, 0.3),
                RawNode.leaf(6, -0.4));
    }
}
