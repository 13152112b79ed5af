/**
 * Lifecycle callbacks: {@link com.arbor.tree.callback.CallbackStage} names the points,
 * {@link com.arbor.tree.callback.CallbackRegistry} holds ordered bindings per node and fires them.
 */
package com.arbor.tree.callback;
