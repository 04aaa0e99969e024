package work.lcod.strata.tree;

import java.util.Objects;

/**
 * Back-reference from a node to whatever is above it: the node that owns it in the same tree,
 * or, for a scope root, the root of the tree the scope inherits from.
 */
public sealed interface ParentLink permits ParentLink.Structural, ParentLink.Scope {
    Node target();

    record Structural(Node parent) implements ParentLink {
        public Structural {
            Objects.requireNonNull(parent, "parent");
        }

        @Override
        public Node target() {
            return parent;
        }
    }

    record Scope(Node inheritedRoot) implements ParentLink {
        public Scope {
            Objects.requireNonNull(inheritedRoot, "inheritedRoot");
        }

        @Override
        public Node target() {
            return inheritedRoot;
        }
    }
}
