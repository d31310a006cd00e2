package typesafeschwalbe.blockgraph.blocks;

import java.util.Map;

import typesafeschwalbe.blockgraph.graph.Block;

/**
 * A behavior whose blocks can change their shape after creation. The shape
 * is described by a string map stored with captured block records.
 */
public interface Reconfigurable {

    Map<String, String> saveMutation(Block block);

    void loadMutation(Block block, Map<String, String> mutation);

}
