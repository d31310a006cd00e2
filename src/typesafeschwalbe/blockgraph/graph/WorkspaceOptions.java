package typesafeschwalbe.blockgraph.graph;

import java.util.Properties;

/**
 * @param typed whether structural type inference and scope resolution run
 *     on this workspace; untyped workspaces rely on nominal checks only
 * @param eventsEnabled initial state of the change notifications
 */
public record WorkspaceOptions(boolean typed, boolean eventsEnabled) {

    public static final String TYPED_PROPERTY = "blockgraph.typed";
    public static final String EVENTS_PROPERTY = "blockgraph.events";

    public static WorkspaceOptions defaults() {
        return new WorkspaceOptions(true, true);
    }

    public static WorkspaceOptions untyped() {
        return new WorkspaceOptions(false, true);
    }

    public static WorkspaceOptions fromProperties(Properties properties) {
        return new WorkspaceOptions(
            WorkspaceOptions.readFlag(properties, TYPED_PROPERTY, true),
            WorkspaceOptions.readFlag(properties, EVENTS_PROPERTY, true)
        );
    }

    private static boolean readFlag(
        Properties properties, String key, boolean fallback
    ) {
        String raw = properties.getProperty(key);
        if(raw == null) {
            return fallback;
        }
        switch(raw.trim().toLowerCase()) {
            case "true":
            case "yes":
            case "on": return true;
            case "false":
            case "no":
            case "off": return false;
            default:
                throw new IllegalArgumentException(
                    "Property '" + key + "' must be a boolean, got '"
                        + raw + "'"
                );
        }
    }

}
