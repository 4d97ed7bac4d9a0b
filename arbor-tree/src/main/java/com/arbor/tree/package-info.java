/**
 * Nested-set tree maintenance.
 *
 * <ul>
 *   <li>{@link com.arbor.tree.TreeNode} – interval contract implemented by payload types</li>
 *   <li>{@link com.arbor.tree.NestedSetTree} – add, insert-before, move, children/descendant/ancestor queries,
 *       staging and {@link com.arbor.tree.NestedSetTree#flush flush}</li>
 *   <li>{@link com.arbor.tree.NestedSetInvariants} – structural checks over a full node set</li>
 *   <li>{@link com.arbor.tree.store} – durable tier contract ({@link com.arbor.tree.store.TreeStore}) and the
 *       heap-backed {@link com.arbor.tree.store.InMemoryTreeStore}</li>
 *   <li>{@link com.arbor.tree.outline} – JSON outline import/export</li>
 * </ul>
 */
package com.arbor.tree;
