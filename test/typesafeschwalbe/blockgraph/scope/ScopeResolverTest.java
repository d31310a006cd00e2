package typesafeschwalbe.blockgraph.scope;

import java.util.Optional;

import org.hamcrest.MatcherAssert;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.Connection;
import typesafeschwalbe.blockgraph.graph.Workspace;
import typesafeschwalbe.blockgraph.graph.WorkspaceOptions;
import typesafeschwalbe.blockgraph.types.DataType;
import typesafeschwalbe.blockgraph.types.TypeContext;
import typesafeschwalbe.blockgraph.variables.BoundVariable;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;

public class ScopeResolverTest {

    private Workspace workspace;
    private TypeContext ctx;

    @Before
    public void setUp() {
        workspace = new Workspace(WorkspaceOptions.defaults());
        ctx = workspace.getTypeContext();
    }

    private static void plug(Block child, Block parent, String input) {
        child.getOutputConnection().get().connect(parent.inputConnection(input));
    }

    private Block letWithNumber(String name, String number) {
        Block let = workspace.newBlock("let_typed");
        let.setFieldValue("VAR", name);
        Block value = workspace.newBlock(
            number.contains(".") ? "float_typed" : "int_typed"
        );
        value.setFieldValue("NUM", number);
        plug(value, let, "EXP1");
        return let;
    }

    private Block getter(String name) {
        Block getter = workspace.newBlock("variables_get_typed");
        getter.setFieldValue("VAR", name);
        return getter;
    }

    @Test
    public void letBodyReferenceIsBoundAndTyped() {
        Block let = letWithNumber("x", "3");
        Block getter = getter("x");

        plug(getter, let, "EXP2");

        BoundVariable.Reference reference = getter.getBoundReferences().get(0);
        Assert.assertTrue(reference.isResolved());
        Assert.assertSame(
            let.getBoundValues().get(0), reference.getBoundValue().get()
        );
        MatcherAssert.assertThat(
            let.getBoundValues().get(0).getReferences(),
            containsInAnyOrder(reference)
        );
        Assert.assertEquals(
            DataType.Type.INTEGER, ctx.get(getter.outputTypeExpr()).type
        );
        Assert.assertEquals(
            DataType.Type.INTEGER, ctx.get(let.outputTypeExpr()).type
        );
        Assert.assertTrue(getter.getWarningText().isEmpty());
    }

    @Test
    public void unpluggedReferenceBecomesUnresolved() {
        Block let = letWithNumber("x", "3");
        Block getter = getter("x");
        plug(getter, let, "EXP2");

        getter.getOutputConnection().get().disconnect();

        BoundVariable.Reference reference = getter.getBoundReferences().get(0);
        Assert.assertFalse(reference.isResolved());
        Assert.assertTrue(let.getBoundValues().get(0).getReferences().isEmpty());
        MatcherAssert.assertThat(
            getter.getWarningText().get(), containsString("x")
        );
        Assert.assertTrue(ctx.isUnbound(getter.outputTypeExpr()));
    }

    @Test
    public void disposingDeclarationUnbindsReferences() {
        Block let = letWithNumber("x", "3");
        Block getter = getter("x");
        plug(getter, let, "EXP2");
        BoundVariable.Reference reference = getter.getBoundReferences().get(0);

        let.dispose(false);

        Assert.assertFalse(reference.isResolved());
    }

    @Test
    public void checkingDoesNotBind() {
        Block let = letWithNumber("x", "3");
        Block getter = getter("y");
        Connection body = let.inputConnection("EXP2");
        Optional<String> warning = getter.getWarningText();

        Assert.assertFalse(ScopeResolver.resolveReference(getter, body, false));
        Assert.assertFalse(getter.getBoundReferences().get(0).isResolved());
        Assert.assertEquals(warning, getter.getWarningText());
        Assert.assertFalse(getter.getOutputConnection().get().canConnect(body));
        Assert.assertFalse(body.isConnected());
    }

    @Test
    public void declarationIsOnlyVisibleInItsBody() {
        Block let = workspace.newBlock("let_typed");
        Block getter = getter("x");

        Assert.assertFalse(
            getter.getOutputConnection().get()
                .canConnect(let.inputConnection("EXP1"))
        );
        Assert.assertTrue(
            getter.getOutputConnection().get()
                .canConnect(let.inputConnection("EXP2"))
        );
    }

    @Test
    public void innerDeclarationShadowsOuter() {
        Block outer = letWithNumber("x", "1");
        Block inner = letWithNumber("x", "1.5");
        plug(inner, outer, "EXP2");
        Block getter = getter("x");

        plug(getter, inner, "EXP2");

        Assert.assertSame(
            inner.getBoundValues().get(0),
            getter.getBoundReferences().get(0).getBoundValue().get()
        );
        Assert.assertEquals(
            DataType.Type.FLOAT, ctx.get(getter.outputTypeExpr()).type
        );
        Assert.assertEquals(
            DataType.Type.FLOAT, ctx.get(outer.outputTypeExpr()).type
        );
    }

    @Test
    public void bubblingCollectsEnclosingDeclarations() {
        Block outer = letWithNumber("y", "1");
        Block inner = letWithNumber("x", "2");
        plug(inner, outer, "EXP2");
        Connection body = inner.inputConnection("EXP2");

        MatcherAssert.assertThat(
            ScopeResolver.allVisibleVariables(body, true).names(),
            containsInAnyOrder("x", "y")
        );
        MatcherAssert.assertThat(
            ScopeResolver.allVisibleVariables(body, false).names(),
            containsInAnyOrder("x")
        );
        Assert.assertTrue(
            ScopeResolver.allVisibleVariables(
                inner.inputConnection("EXP1"), true
            ).lookup("x").isEmpty()
        );
    }

    @Test
    public void renamingDeclarationRenamesReferences() {
        Block let = letWithNumber("x", "3");
        Block getter = getter("x");
        plug(getter, let, "EXP2");

        let.setFieldValue("VAR", "z");

        Assert.assertEquals("z", getter.getFieldValue("VAR"));
        Assert.assertTrue(getter.getBoundReferences().get(0).isResolved());
    }

    @Test
    public void renamingReferenceDropsItsBinding() {
        Block let = letWithNumber("x", "3");
        Block getter = getter("x");
        plug(getter, let, "EXP2");
        BoundVariable.Reference reference = getter.getBoundReferences().get(0);

        getter.setFieldValue("VAR", "y");

        Assert.assertEquals("y", reference.getVariableName());
        Assert.assertFalse(reference.isResolved());
        Assert.assertTrue(let.getBoundValues().get(0).getReferences().isEmpty());
        MatcherAssert.assertThat(
            getter.getWarningText().get(), containsString("y")
        );
        Assert.assertTrue(ctx.isUnbound(getter.outputTypeExpr()));

        getter.setFieldValue("VAR", "x");

        Assert.assertSame(
            let.getBoundValues().get(0), reference.getBoundValue().get()
        );
        Assert.assertTrue(getter.getWarningText().isEmpty());
        Assert.assertEquals(
            DataType.Type.INTEGER, ctx.get(getter.outputTypeExpr()).type
        );
    }

    @Test
    public void renamingDeclarationCapturesMatchingReferences() {
        Block let = letWithNumber("x", "3");
        Block getter = getter("x");
        plug(getter, let, "EXP2");
        getter.setFieldValue("VAR", "y");
        Assert.assertFalse(getter.getBoundReferences().get(0).isResolved());

        let.setFieldValue("VAR", "y");

        Assert.assertSame(
            let.getBoundValues().get(0),
            getter.getBoundReferences().get(0).getBoundValue().get()
        );
        Assert.assertEquals(
            DataType.Type.INTEGER, ctx.get(let.outputTypeExpr()).type
        );
    }

}
