package typesafeschwalbe.blockgraph.graph;

import org.hamcrest.MatcherAssert;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import typesafeschwalbe.blockgraph.types.DataType;
import typesafeschwalbe.blockgraph.types.TypeContext;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.hasItem;

public class ConnectionTest {

    private Workspace workspace;
    private TypeContext ctx;

    @Before
    public void setUp() {
        workspace = new Workspace(WorkspaceOptions.defaults());
        ctx = workspace.getTypeContext();
    }

    private static Connection output(Block block) {
        return block.getOutputConnection().get();
    }

    @Test
    public void intLiteralPlugsIntoArithmetic() {
        Block number = workspace.newBlock("int_typed");
        Block sum = workspace.newBlock("int_arithmetic_typed");
        Connection socket = sum.inputConnection("A");

        Assert.assertTrue(output(number).canConnect(socket));
        output(number).connect(socket);

        Assert.assertEquals(
            DataType.Type.INTEGER, ctx.get(socket.getTypeExpr().get()).type
        );
        Assert.assertEquals(
            DataType.Type.INTEGER, ctx.get(number.outputTypeExpr()).type
        );
        Assert.assertSame(number, sum.getInputTargetBlock("A").get());
        Assert.assertSame(sum, number.getParent().get());
        MatcherAssert.assertThat(workspace.getTopBlocks(), contains(sum));
    }

    @Test
    public void connectionsTargetEachOther() {
        Block number = workspace.newBlock("int_typed");
        Block sum = workspace.newBlock("int_arithmetic_typed");
        Connection socket = sum.inputConnection("B");
        socket.connect(output(number));

        Assert.assertSame(socket, output(number).getTargetConnection().get());
        Assert.assertSame(output(number), socket.getTargetConnection().get());
        Assert.assertFalse(
            workspace.getConnectionRegistry().isRegistered(socket)
        );
        Assert.assertFalse(
            workspace.getConnectionRegistry().isRegistered(output(number))
        );

        output(number).disconnect();

        Assert.assertFalse(socket.isConnected());
        Assert.assertFalse(output(number).isConnected());
        Assert.assertTrue(
            workspace.getConnectionRegistry().isRegistered(socket)
        );
        Assert.assertTrue(number.getParent().isEmpty());
        MatcherAssert.assertThat(
            workspace.getTopBlocks(), containsInAnyOrder(sum, number)
        );
    }

    @Test
    public void nominalCheckRejectsBooleanInIntSocket() {
        Block bool = workspace.newBlock("logic_boolean_typed");
        Block sum = workspace.newBlock("int_arithmetic_typed");
        Connection socket = sum.inputConnection("A");

        Assert.assertFalse(output(bool).canConnect(socket));
        Assert.assertThrows(IllegalStateException.class,
            () -> output(bool).connect(socket));

        Assert.assertFalse(socket.isConnected());
        Assert.assertTrue(bool.getParent().isEmpty());
        MatcherAssert.assertThat(
            workspace.getTopBlocks(), containsInAnyOrder(bool, sum)
        );
    }

    @Test
    public void structuralCheckRejectsNonPair() {
        Block number = workspace.newBlock("int_typed");
        Block first = workspace.newBlock("pair_first_typed");
        Assert.assertFalse(
            output(number).canConnect(first.inputConnection("FIRST"))
        );
        Block pair = workspace.newBlock("pair_create_typed");
        Assert.assertTrue(
            output(pair).canConnect(first.inputConnection("FIRST"))
        );
    }

    @Test
    public void inferredTypesConstrainLaterConnections() {
        Block compare = workspace.newBlock("logic_compare_typed");
        Block number = workspace.newBlock("int_typed");
        Block decimal = workspace.newBlock("float_typed");
        output(number).connect(compare.inputConnection("A"));

        Assert.assertFalse(
            output(decimal).canConnect(compare.inputConnection("B"))
        );
        Block other = workspace.newBlock("int_typed");
        Assert.assertTrue(
            output(other).canConnect(compare.inputConnection("B"))
        );
    }

    @Test
    public void occupiedSocketsAndCyclesAreRejected() {
        Block outer = workspace.newBlock("pair_create_typed");
        Block inner = workspace.newBlock("pair_create_typed");
        Block number = workspace.newBlock("int_typed");
        output(inner).connect(outer.inputConnection("FIRST"));
        output(number).connect(inner.inputConnection("FIRST"));

        Block spare = workspace.newBlock("int_typed");
        Assert.assertFalse(
            output(spare).canConnect(inner.inputConnection("FIRST"))
        );
        Assert.assertFalse(
            output(outer).canConnect(inner.inputConnection("SECOND"))
        );
        Assert.assertFalse(
            output(inner).canConnect(inner.inputConnection("SECOND"))
        );
    }

    @Test
    public void registryOffersCompatibleCandidates() {
        Block sum = workspace.newBlock("int_arithmetic_typed");
        Block first = workspace.newBlock("pair_first_typed");
        Block number = workspace.newBlock("int_typed");
        ConnectionRegistry registry = workspace.getConnectionRegistry();

        MatcherAssert.assertThat(
            registry.candidatesFor(output(number)),
            containsInAnyOrder(sum.inputConnection("A"),
                sum.inputConnection("B"))
        );
        MatcherAssert.assertThat(
            registry.candidatesFor(output(number)),
            not(hasItem(first.inputConnection("FIRST")))
        );
    }

    @Test
    public void disposedConnectionsLeaveTheRegistry() {
        Block number = workspace.newBlock("int_typed");
        Connection out = output(number);
        number.dispose(false);
        Assert.assertTrue(out.isDisposed());
        Assert.assertFalse(workspace.getConnectionRegistry().isRegistered(out));
        Assert.assertEquals(0, workspace.getConnectionRegistry().size());
    }

    @Test
    public void connectedConnectionCannotBeDisposed() {
        Block number = workspace.newBlock("int_typed");
        Block sum = workspace.newBlock("int_arithmetic_typed");
        output(number).connect(sum.inputConnection("A"));
        Assert.assertThrows(IllegalStateException.class,
            () -> output(number).dispose());
    }

    @Test
    public void untypedWorkspaceOnlyChecksNames() {
        Workspace untyped = new Workspace(WorkspaceOptions.untyped());
        Block number = untyped.newBlock("int_typed");
        Block first = untyped.newBlock("pair_first_typed");
        Block bool = untyped.newBlock("logic_boolean_typed");
        Block sum = untyped.newBlock("int_arithmetic_typed");

        Assert.assertTrue(number.getOutputConnection().get().getTypeExpr()
            .isEmpty());
        Assert.assertTrue(number.getOutputConnection().get()
            .canConnect(first.inputConnection("FIRST")));
        Assert.assertFalse(bool.getOutputConnection().get()
            .canConnect(sum.inputConnection("A")));
        number.getOutputConnection().get()
            .connect(first.inputConnection("FIRST"));
        Assert.assertTrue(first.updateTypeInference(true).isEmpty());
    }

}
