package org.overlaynet.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Directed graph recording which peer introduced which address.
 * <p>
 * Nodes are either address-only entries or verified peers, see {@link NodeKey}.
 * An edge <tt>u &rarr; v</tt> means "u introduced v". Every node has at most one
 * incoming edge. Outgoing edges keep their insertion order.
 * <p>
 * Not thread-safe: {@link PeerRegistry} serializes all access.
 */
public class ProvenanceGraph {

	public enum NodeType {
		ADDRESS,
		PEER
	}

	/** Graph node identifier: an address for unverified entries, an identity key for verified peers. */
	public static final class NodeKey {
		private final NodeType type;
		private final Object value;

		private NodeKey(NodeType type, Object value) {
			this.type = type;
			this.value = Objects.requireNonNull(value);
		}

		public static NodeKey ofAddress(PeerAddress address) {
			return new NodeKey(NodeType.ADDRESS, address);
		}

		public static NodeKey ofPeer(IdentityKey identityKey) {
			return new NodeKey(NodeType.PEER, identityKey);
		}

		public NodeType getType() {
			return this.type;
		}

		/** Only valid for {@link NodeType#ADDRESS} keys. */
		public PeerAddress getAddress() {
			if (this.type != NodeType.ADDRESS)
				throw new IllegalStateException("Not an address node: " + this);

			return (PeerAddress) this.value;
		}

		/** Only valid for {@link NodeType#PEER} keys. */
		public IdentityKey getIdentityKey() {
			if (this.type != NodeType.PEER)
				throw new IllegalStateException("Not a peer node: " + this);

			return (IdentityKey) this.value;
		}

		@Override
		public boolean equals(Object other) {
			if (this == other)
				return true;

			if (!(other instanceof NodeKey))
				return false;

			NodeKey otherKey = (NodeKey) other;
			return this.type == otherKey.type && this.value.equals(otherKey.value);
		}

		@Override
		public int hashCode() {
			return 31 * this.type.hashCode() + this.value.hashCode();
		}

		@Override
		public String toString() {
			return this.type + ":" + this.value;
		}
	}

	private static class Node {
		private final List<NodeKey> children = new ArrayList<>();
	}

	// Insertion-ordered so address listings are stable
	private final Map<NodeKey, Node> nodes = new LinkedHashMap<>();
	// child -> its single parent
	private final Map<NodeKey, NodeKey> parents = new HashMap<>();

	public boolean hasNode(NodeKey key) {
		return this.nodes.containsKey(key);
	}

	/** Adds node if absent. Returns true if node was created. */
	public boolean addNode(NodeKey key) {
		if (this.nodes.containsKey(key))
			return false;

		this.nodes.put(key, new Node());
		return true;
	}

	public boolean hasEdge(NodeKey from, NodeKey to) {
		return from.equals(this.parents.get(to));
	}

	public boolean hasParent(NodeKey key) {
		return this.parents.containsKey(key);
	}

	/** Returns parent of node, or null if node is unknown or parentless. */
	public NodeKey getParent(NodeKey key) {
		return this.parents.get(key);
	}

	/**
	 * Adds edge <tt>from &rarr; to</tt>.
	 * <p>
	 * Both nodes must already exist and <tt>to</tt> must not have a parent.
	 */
	public void addEdge(NodeKey from, NodeKey to) {
		Node fromNode = this.nodes.get(from);
		if (fromNode == null || !this.nodes.containsKey(to))
			throw new IllegalStateException("Both nodes must exist to add edge " + from + " -> " + to);

		if (this.parents.containsKey(to))
			throw new IllegalStateException("Node " + to + " already has parent " + this.parents.get(to));

		if (from.equals(to))
			throw new IllegalStateException("Refusing self-introduction of " + from);

		fromNode.children.add(to);
		this.parents.put(to, from);
	}

	/** Returns children of node in edge-insertion order, empty if node is unknown. */
	public List<NodeKey> getChildren(NodeKey key) {
		Node node = this.nodes.get(key);
		if (node == null)
			return Collections.emptyList();

		return new ArrayList<>(node.children);
	}

	/**
	 * Removes node along with all incoming and outgoing edges.
	 * Children are left in place without a parent.
	 *
	 * @return true if node existed
	 */
	public boolean removeNode(NodeKey key) {
		Node node = this.nodes.remove(key);
		if (node == null)
			return false;

		for (NodeKey child : node.children)
			this.parents.remove(child);

		NodeKey parent = this.parents.remove(key);
		if (parent != null)
			this.nodes.get(parent).children.remove(key);

		return true;
	}

	/**
	 * Replaces <tt>oldKey</tt> with <tt>newKey</tt>, keeping its incoming edge and all outgoing edges.
	 * <p>
	 * <tt>newKey</tt> takes the position of <tt>oldKey</tt> in its parent's child list.
	 *
	 * @return true if <tt>oldKey</tt> existed and was replaced
	 */
	public boolean replaceNode(NodeKey oldKey, NodeKey newKey) {
		if (!this.nodes.containsKey(oldKey))
			return false;

		if (this.nodes.containsKey(newKey))
			throw new IllegalStateException("Cannot replace " + oldKey + " with existing node " + newKey);

		Node node = this.nodes.remove(oldKey);
		this.nodes.put(newKey, node);

		for (NodeKey child : node.children)
			this.parents.put(child, newKey);

		NodeKey parent = this.parents.remove(oldKey);
		if (parent != null) {
			List<NodeKey> siblings = this.nodes.get(parent).children;
			siblings.set(siblings.indexOf(oldKey), newKey);
			this.parents.put(newKey, parent);
		}

		return true;
	}

	/**
	 * Folds <tt>absorbedKey</tt> into existing <tt>survivorKey</tt>.
	 * <p>
	 * Outgoing edges of the absorbed node are appended to the survivor's, unless the survivor
	 * would become its own child. The absorbed node's incoming edge is dropped if the survivor
	 * already has a parent, otherwise it is inherited.
	 *
	 * @return true if <tt>absorbedKey</tt> existed
	 */
	public boolean mergeInto(NodeKey absorbedKey, NodeKey survivorKey) {
		Node absorbed = this.nodes.get(absorbedKey);
		Node survivor = this.nodes.get(survivorKey);
		if (absorbed == null)
			return false;

		if (survivor == null)
			throw new IllegalStateException("Cannot merge " + absorbedKey + " into missing node " + survivorKey);

		List<NodeKey> orphans = new ArrayList<>(absorbed.children);
		NodeKey absorbedParent = this.parents.get(absorbedKey);

		this.removeNode(absorbedKey);

		for (NodeKey orphan : orphans)
			if (!orphan.equals(survivorKey))
				this.addEdge(survivorKey, orphan);

		if (absorbedParent != null && !absorbedParent.equals(survivorKey) && !this.parents.containsKey(survivorKey))
			this.addEdge(absorbedParent, survivorKey);

		return true;
	}

	/** Returns all nodes of given type, in creation order. */
	public List<NodeKey> getNodes(NodeType type) {
		List<NodeKey> result = new ArrayList<>();
		for (NodeKey key : this.nodes.keySet())
			if (key.getType() == type)
				result.add(key);

		return result;
	}

	public int nodeCount() {
		return this.nodes.size();
	}

	public int edgeCount() {
		return this.parents.size();
	}

}
