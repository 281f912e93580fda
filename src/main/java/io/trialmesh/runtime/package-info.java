/**
 * Runtime orchestration package.
 *
 * <p>{@link io.trialmesh.runtime.TrialMeshRuntime} wires the store, parameter compiler,
 * dispatcher, workers and result collector from one explicit configuration, and is the only
 * entry point the CLI uses.
 */
package io.trialmesh.runtime;
