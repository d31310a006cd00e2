package typesafeschwalbe.blockgraph.graph;

import java.util.Map;
import java.util.Optional;

import org.hamcrest.MatcherAssert;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import typesafeschwalbe.blockgraph.Result;
import typesafeschwalbe.blockgraph.types.DataType;
import typesafeschwalbe.blockgraph.variables.BoundVariable;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

public class BlockRecordTest {

    private Workspace workspace;

    @Before
    public void setUp() {
        workspace = new Workspace(WorkspaceOptions.defaults());
    }

    private static void plug(Block child, Block parent, String input) {
        child.getOutputConnection().get().connect(parent.inputConnection(input));
    }

    private Block letXIsThreeInX() {
        Block let = workspace.newBlock("let_typed");
        Block number = workspace.newBlock("int_typed");
        number.setFieldValue("NUM", "3");
        Block getter = workspace.newBlock("variables_get_typed");
        plug(number, let, "EXP1");
        plug(getter, let, "EXP2");
        return let;
    }

    @Test
    public void captureDescribesTheTree() {
        Block let = letXIsThreeInX();

        BlockRecord record = BlockRecord.capture(let);

        Assert.assertEquals("let_typed", record.type());
        Assert.assertEquals(let.id, record.id());
        Assert.assertEquals(Map.of("VAR", "x"), record.fields());
        Assert.assertEquals("3", record.inputs().get("EXP1").fields().get("NUM"));
        Assert.assertEquals(
            "variables_get_typed", record.inputs().get("EXP2").type()
        );
        Assert.assertTrue(record.next().isEmpty());
    }

    @Test
    public void restoredTreeIsResolvedAndTyped() {
        BlockRecord record = BlockRecord.capture(letXIsThreeInX());
        Workspace other = new Workspace(WorkspaceOptions.defaults());

        Result<Block> restored = BlockRecord.restore(other, record);

        Assert.assertTrue(restored.isValue());
        Block let = restored.getValue();
        Assert.assertEquals(record.id(), let.id);
        Block getter = let.getInputTargetBlock("EXP2").get();
        BoundVariable.Reference reference = getter.getBoundReferences().get(0);
        Assert.assertSame(
            let.getBoundValues().get(0), reference.getBoundValue().get()
        );
        Assert.assertEquals(
            DataType.Type.INTEGER,
            other.getTypeContext().get(let.outputTypeExpr()).type
        );
        Assert.assertEquals(record, BlockRecord.capture(let));
        MatcherAssert.assertThat(other.getAllBlocks(), hasSize(3));
        MatcherAssert.assertThat(other.getTopBlocks(), hasSize(1));
    }

    @Test
    public void restoringIntoTheSameWorkspaceUsesNewIds() {
        Block original = letXIsThreeInX();

        Block copy = BlockRecord.restore(
            workspace, BlockRecord.capture(original)
        ).getValue();

        Assert.assertNotEquals(original.id, copy.id);
        MatcherAssert.assertThat(workspace.getAllBlocks(), hasSize(6));
        Assert.assertTrue(
            copy.getInputTargetBlock("EXP2").get()
                .getBoundReferences().get(0).isResolved()
        );
    }

    @Test
    public void statementStacksAndMutationsSurvive() {
        Block first = workspace.newBlock("print_typed");
        Block second = workspace.newBlock("print_typed");
        first.getNextConnection().get()
            .connect(second.getPreviousConnection().get());
        Block list = workspace.newBlock("lists_create_with_typed");
        list.getOutputConnection().get()
            .connect(second.inputConnection("TEXT"));
        Workspace other = new Workspace(WorkspaceOptions.defaults());

        BlockRecord record = BlockRecord.capture(first);
        Block restored = BlockRecord.restore(other, record).getValue();

        Assert.assertEquals(
            "3", record.next().get().inputs().get("TEXT").mutation().get("items")
        );
        Block restoredSecond = restored.getNextBlock().get();
        Block restoredList = restoredSecond.getInputTargetBlock("TEXT").get();
        Assert.assertTrue(restoredList.getInput("ADD2").isPresent());
        Assert.assertTrue(restoredList.getInput("ADD3").isEmpty());
    }

    @Test
    public void unknownBlockTypeRestoresNothing() {
        BlockRecord unknown = new BlockRecord(
            "mystery_block", "m1", Map.of(), Map.of(), Map.of(),
            Optional.empty()
        );
        BlockRecord record = new BlockRecord(
            "let_typed", "l1", Map.of("VAR", "x"), Map.of(),
            Map.of("EXP2", unknown), Optional.empty()
        );

        Result<Block> restored = BlockRecord.restore(workspace, record);

        Assert.assertTrue(restored.isError());
        MatcherAssert.assertThat(restored.getError(), hasSize(1));
        MatcherAssert.assertThat(
            restored.getError().get(0).message(),
            containsString("mystery_block")
        );
        MatcherAssert.assertThat(workspace.getAllBlocks(), empty());
    }

    @Test
    public void invalidFieldValuesAreIgnored() {
        BlockRecord record = new BlockRecord(
            "int_typed", null, Map.of("NUM", "three", "COLOUR", "red"),
            Map.of(), Map.of(), Optional.empty()
        );

        Block number = BlockRecord.restore(workspace, record).getValue();

        Assert.assertEquals("0", number.getFieldValue("NUM"));
        Assert.assertNotNull(number.id);
        Assert.assertTrue(workspace.getBlockById(number.id).isPresent());
    }

}
