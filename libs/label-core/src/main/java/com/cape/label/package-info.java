/**
 * Label interning and composition engine.
 *
 * <ul>
 *   <li>{@link com.cape.label.TokenInterner}: token value to stable id
 *   <li>{@link com.cape.label.TokenSetCanonicalizer}: content-addressed token-sets
 *   <li>{@link com.cape.label.GroupRegistry}: named, mutable, shared token-sets
 *   <li>{@link com.cape.label.LevelComposer}: levels and effective sets
 *   <li>{@link com.cape.label.ObjectStore}: identified objects carrying a level
 * </ul>
 *
 * <p>{@link com.cape.label.LabelEngine} bundles them over one {@link
 * com.cape.label.store.LabelStore}.
 */
package com.cape.label;
