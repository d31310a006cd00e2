package typesafeschwalbe.blockgraph.graph;

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

public class WorkspaceOptionsTest {

    @Test
    public void missingPropertiesUseDefaults() {
        Assert.assertEquals(
            WorkspaceOptions.defaults(),
            WorkspaceOptions.fromProperties(new Properties())
        );
    }

    @Test
    public void flagsAcceptCommonSpellings() {
        Properties properties = new Properties();
        properties.setProperty(WorkspaceOptions.TYPED_PROPERTY, " No ");
        properties.setProperty(WorkspaceOptions.EVENTS_PROPERTY, "on");

        WorkspaceOptions options = WorkspaceOptions.fromProperties(properties);

        Assert.assertFalse(options.typed());
        Assert.assertTrue(options.eventsEnabled());
        Assert.assertFalse(new Workspace(options).isTyped());
    }

    @Test
    public void malformedFlagIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(WorkspaceOptions.EVENTS_PROPERTY, "maybe");

        IllegalArgumentException e = Assert.assertThrows(
            IllegalArgumentException.class,
            () -> WorkspaceOptions.fromProperties(properties)
        );
        Assert.assertTrue(
            e.getMessage().contains(WorkspaceOptions.EVENTS_PROPERTY)
        );
    }

}
