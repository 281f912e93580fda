/**
 * TrialMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.trialmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.trialmesh.cli.TrialMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.trialmesh.runtime.TrialMeshRuntime} wires compilation, dispatch and result collection.</li>
 *   <li>{@code io.trialmesh.parameter.ParameterCompiler} turns distributions into per-trial input values.</li>
 *   <li>{@code io.trialmesh.storage.SimulationStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.trialmesh;
