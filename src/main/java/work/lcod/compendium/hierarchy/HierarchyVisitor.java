package work.lcod.compendium.hierarchy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/**
 * Callback applied to every node of a document hierarchy.
 *
 * @param <C> context handed from a node to its embedded children
 */
@FunctionalInterface
public interface HierarchyVisitor<C> {
    /**
     * @param node the node being visited; may be mutated
     * @param collection the collection the node belongs to
     * @param context the value returned for the node's owner, or the initial context for the root
     * @return the context for this node's children
     */
    C visit(ObjectNode node, Collection collection, C context) throws IOException;
}
