/**
 * The ext API associates arbitrary typed data with IR nodes, which are all
 * {@link io.github.eutro.irkit.ext.ExtContainer}s.
 *
 * <pre>{@code
 * public static final Ext<Integer> DEPTH = Ext.create(Integer.class, "DEPTH");
 *
 * op.attachExt(DEPTH, 3);
 * op.getExtOrThrow(DEPTH); // => 3
 * }</pre>
 * <p>
 * Analyses use this for scratch data they discard afterwards, without changing
 * the node classes or passing {@link java.util.Map}s around.
 * <p>
 * Operations delegate to their {@link io.github.eutro.irkit.ir.OpKind}, so a fact
 * attached to a kind, such as {@link io.github.eutro.irkit.ext.CommonExts#IS_PURE},
 * is visible on every operation of that kind.
 * <p>
 * Nodes store the owner exts in {@link io.github.eutro.irkit.ext.CommonExts} directly in fields.
 */
package io.github.eutro.irkit.ext;
