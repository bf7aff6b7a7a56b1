package com.sylva.codegen.compiler.render;

import com.sylva.codegen.api.backend.BackendDescriptor;
import com.sylva.codegen.api.model.FeatureUniverse;
import com.sylva.codegen.api.model.RawNode;
import com.sylva.codegen.api.model.Tree;
import com.sylva.codegen.compiler.BackendFixtures;
import com.sylva.codegen.compiler.TreeIrBuilder;
import com.sylva.codegen.compiler.feature.FeatureResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sylva.codegen.compiler.BackendFixtures.stump;
import static com.sylva.codegen.compiler.BackendFixtures.twoLevel;
import static org.assertj.core.api.Assertions.assertThat;

class TreeLogicRendererTest {

    private final TemplateRenderer templates = new TemplateRenderer();
    private final TreeLogicRenderer renderer = new TreeLogicRenderer(templates, new LiteralFormatter(templates));
    private final TreeIrBuilder builder = new TreeIrBuilder(new FeatureResolver(FeatureUniverse.ofCount(8)));

    @Test
    @DisplayName("Expression-style targets accumulate the tree result at the root close")
    void expressionStyle() {
        Tree tree = builder.build(0, stump("f5", 0.3, -0.1, 0.2));

        assertThat(renderer.render(tree, BackendFixtures.expressionDescriptor())).isEqualTo(
                "    x = if i64_le(f[5], i64{sgn:true, v: 3000000000}) {\n"
                        + "         i64{sgn:false, v: 1000000000}\n"
                        + "    } else {\n"
                        + "         i64{sgn:true, v: 2000000000}\n"
                        + "     };\n"
                        + "     y = i64_add(y, x);\n");
    }

    @Test
    @DisplayName("Statement-style targets accumulate in every leaf")
    void statementStyle() {
        Tree tree = builder.build(0, stump("f5", 0.3, -0.1, 0.2));

        assertThat(renderer.render(tree, BackendFixtures.statementDescriptor())).isEqualTo(
                "    if fixed_le(f[5], 3000000000):\n"
                        + "        y = fixed_add(y, -1000000000)\n"
                        + "    else:\n"
                        + "        y = fixed_add(y, 2000000000)\n");
    }

    @Test
    @DisplayName("Each level adds one indentation unit, yes branch first")
    void nestedIndentation() {
        Tree tree = builder.build(0, twoLevel("f0", "f1", "f2"));

        assertThat(renderer.render(tree, BackendFixtures.statementDescriptor())).isEqualTo(
                "    if fixed_le(f[0], 5000000000):\n"
                        + "        if fixed_le(f[1], -12500000000):\n"
                        + "            y = fixed_add(y, 1000000000)\n"
                        + "        else:\n"
                        + "            y = fixed_add(y, -2000000000)\n"
                        + "    else:\n"
                        + "        if fixed_le(f[2], 20000000000):\n"
                        + "            y = fixed_add(y, 3000000000)\n"
                        + "        else:\n"
                        + "            y = fixed_add(y, -4000000000)\n");
    }

    @Test
    @DisplayName("A single-leaf tree uses the root leaf pattern")
    void singleLeafTree() {
        Tree tree = builder.build(0, List.of(RawNode.leaf(0, 0.75)));

        assertThat(renderer.render(tree, BackendFixtures.expressionDescriptor()))
                .isEqualTo("     y = i64_add(y, i64{sgn:true, v: 7500000000});\n");
        assertThat(renderer.render(tree, BackendFixtures.statementDescriptor()))
                .isEqualTo("    y = fixed_add(y, 7500000000)\n");
    }

    @Test
    @DisplayName("Tab indentation and blank pattern lines")
    void tabsAndBlankLines() {
        BackendDescriptor base = BackendFixtures.statementDescriptor();
        BackendDescriptor tabs = new BackendDescriptor(base.name(), base.fileExtension(), base.commentPrefix(),
                new BackendDescriptor.Indentation("tabs", 1), base.fixedPoint(), base.operators(),
                base.featureAccess(),
                new BackendDescriptor.ControlSyntax(
                        List.of("if ${condition}:"), List.of("if ${condition}:"), List.of("else:"),
                        List.of(), List.of("", "# end of tree ${tree_index}"),
                        List.of("${accumulator} = ${add}"), null),
                base.accumulator(), base.treeResult(), base.input(), base.extraTemplates(), base.companionFiles());
        Tree tree = builder.build(4, stump("f1", 1.0, 1.0, 2.0));

        assertThat(renderer.render(tree, tabs)).isEqualTo(
                "\tif fixed_le(f[1], 10000000000):\n"
                        + "\t\ty = fixed_add(y, 10000000000)\n"
                        + "\telse:\n"
                        + "\t\ty = fixed_add(y, 20000000000)\n"
                        + "\n"
                        + "\t# end of tree 4\n");
    }

    @Test
    @DisplayName("Rendering is deterministic")
    void renderingIsDeterministic() {
        Tree tree = builder.build(0, twoLevel("f3", "f4", "f7"));
        BackendDescriptor descriptor = BackendFixtures.expressionDescriptor();

        assertThat(renderer.render(tree, descriptor)).isEqualTo(renderer.render(tree, descriptor));
    }
}
