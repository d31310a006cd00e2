package typesafeschwalbe.blockgraph.events;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.hamcrest.MatcherAssert;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import typesafeschwalbe.blockgraph.graph.Block;
import typesafeschwalbe.blockgraph.graph.Coordinate;
import typesafeschwalbe.blockgraph.graph.Workspace;
import typesafeschwalbe.blockgraph.graph.WorkspaceOptions;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

public class EventBusTest {

    private Workspace workspace;
    private List<BlockEvent> events;

    @Before
    public void setUp() {
        workspace = new Workspace(WorkspaceOptions.defaults());
        events = new ArrayList<>();
        workspace.getEventBus().addListener(events::add);
    }

    @Test
    public void creationIsAnnouncedOnce() {
        Block block = workspace.newBlock("lists_create_with_typed");

        MatcherAssert.assertThat(events, hasSize(1));
        Assert.assertEquals(BlockEvent.Type.CREATE, events.get(0).type);
        Assert.assertEquals(block.id, events.get(0).blockId);
    }

    @Test
    public void connectingFiresMove() {
        Block number = workspace.newBlock("int_typed");
        Block sum = workspace.newBlock("int_arithmetic_typed");
        events.clear();

        number.getOutputConnection().get().connect(sum.inputConnection("A"));

        MatcherAssert.assertThat(events, hasSize(1));
        BlockEvent event = events.get(0);
        Assert.assertEquals(BlockEvent.Type.MOVE, event.type);
        Assert.assertEquals(number.id, event.blockId);
        BlockEvent.Move move = event.getValue();
        Assert.assertEquals(Optional.empty(), move.oldParentId());
        Assert.assertEquals(Optional.of(sum.id), move.newParentId());
        Assert.assertEquals(Optional.of("A"), move.newInputName());
    }

    @Test
    public void movingTopBlockReportsCoordinates() {
        Block number = workspace.newBlock("int_typed");
        events.clear();

        number.moveBy(10, 20);

        BlockEvent.Move move = events.get(0).getValue();
        Assert.assertEquals(Coordinate.ORIGIN, move.oldCoordinate());
        Assert.assertEquals(new Coordinate(10, 20), move.newCoordinate());
    }

    @Test
    public void batchCoalescesChanges() {
        Block block = workspace.newBlock("int_typed");
        events.clear();

        try(EventBus.Scope batch = workspace.getEventBus().batch()) {
            block.setCommentText("first");
            block.setCommentText("second");
            MatcherAssert.assertThat(events, empty());
        }

        MatcherAssert.assertThat(events, hasSize(1));
        BlockEvent.Change change = events.get(0).getValue();
        Assert.assertEquals("comment", change.element());
        Assert.assertNull(change.oldValue());
        Assert.assertEquals("second", change.newValue());
    }

    @Test
    public void batchDropsChangesThatCancelOut() {
        Block block = workspace.newBlock("int_typed");
        events.clear();

        try(EventBus.Scope batch = workspace.getEventBus().batch()) {
            block.setDisabled(true);
            block.setDisabled(false);
        }

        MatcherAssert.assertThat(events, empty());
    }

    @Test
    public void batchKeepsDifferentElementsInOrder() {
        Block block = workspace.newBlock("int_typed");
        events.clear();

        try(EventBus.Scope batch = workspace.getEventBus().batch()) {
            block.setCollapsed(true);
            block.setFieldValue("NUM", "4");
        }

        List<String> elements = new ArrayList<>();
        for(BlockEvent event: events) {
            elements.add(event.<BlockEvent.Change>getValue().element());
        }
        MatcherAssert.assertThat(elements, contains("collapsed", "field"));
    }

    @Test
    public void mutedEventsAreDropped() {
        Block block = workspace.newBlock("int_typed");
        events.clear();

        try(EventBus.Scope muted = workspace.getEventBus().mute()) {
            block.setCollapsed(true);
        }
        block.setCollapsed(false);

        MatcherAssert.assertThat(events, hasSize(1));
        Assert.assertEquals(
            false, events.get(0).<BlockEvent.Change>getValue().newValue()
        );
    }

    @Test
    public void disabledBusStaysQuiet() {
        Workspace quiet = new Workspace(new WorkspaceOptions(true, false));
        List<BlockEvent> received = new ArrayList<>();
        quiet.getEventBus().addListener(received::add);

        Block block = quiet.newBlock("int_typed");
        block.setCommentText("note");
        quiet.getEventBus().setEnabled(true);
        block.dispose(false);

        MatcherAssert.assertThat(received, hasSize(1));
        Assert.assertEquals(BlockEvent.Type.DELETE, received.get(0).type);
    }

    @Test
    public void removedListenerIsNotCalled() {
        List<BlockEvent> other = new ArrayList<>();
        Consumer<BlockEvent> listener = other::add;
        workspace.getEventBus().addListener(listener);
        workspace.newBlock("int_typed");
        workspace.getEventBus().removeListener(listener);

        workspace.newBlock("int_typed");

        MatcherAssert.assertThat(other, hasSize(1));
        MatcherAssert.assertThat(events, hasSize(2));
    }

}
