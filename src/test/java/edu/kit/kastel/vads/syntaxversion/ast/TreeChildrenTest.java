package edu.kit.kastel.vads.syntaxversion.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeChildrenTest {

    private final NameTree x = new NameTree("x");
    private final NameTree y = new NameTree("y");

    @Test
    void whenListingChildren_givenAbsentOptionalField_shouldSkipIt() {
        AnnAssignTree declaration = new AnnAssignTree(x, y, null, true);

        assertEquals(List.of(x, y), declaration.children());
    }

    @Test
    void whenListingChildren_givenLeaf_shouldReturnEmpty() {
        assertTrue(new StringLiteralTree("s").children().isEmpty());
        assertTrue(new NonlocalTree(List.of("a", "b")).children().isEmpty());
    }

    @Test
    void whenListingChildren_givenFunction_shouldFollowFieldOrder() {
        ArgumentsTree arguments = ArgumentsTree.empty();
        PassTree body = new PassTree();
        NameTree decorator = new NameTree("cache");
        NameTree returns = new NameTree("int");
        TypeVarTree typeParam = new TypeVarTree("T", null);

        FunctionDefTree function = new FunctionDefTree(
            "f", arguments, List.of(body), List.of(decorator), returns, List.of(typeParam), false);

        assertEquals(List.of(arguments, body, decorator, returns, typeParam), function.children());
    }

    @Test
    void whenListingChildren_givenFormattedValue_shouldIncludeFormatSpec() {
        FormattedStringTree formatSpec = new FormattedStringTree(List.of(new StringLiteralTree(">10")));
        FormattedValueTree value = new FormattedValueTree(x, FormattedValueTree.NO_CONVERSION, formatSpec);

        assertEquals(List.of(x, formatSpec), value.children());
    }

    @Test
    void whenListingChildren_givenKeywordOnlyWithoutDefault_shouldSkipMissingDefault() {
        ArgTree key = ArgTree.named("key");
        ArgumentsTree arguments = new ArgumentsTree(
            List.of(), List.of(), null, List.of(key), Arrays.asList(null, y), null, List.of(), null, null);

        assertEquals(List.of(key, y), arguments.children());
        assertEquals(2, arguments.keywordDefaults().size());
    }

    @Test
    void whenCreating_givenMutableList_shouldCopyIt() {
        List<StatementTree> body = new ArrayList<>(List.of(new PassTree()));
        ModuleTree module = new ModuleTree(body);

        body.add(new BreakTree());

        assertEquals(1, module.body().size());
        assertThrows(UnsupportedOperationException.class, () -> module.body().add(new PassTree()));
    }
}
