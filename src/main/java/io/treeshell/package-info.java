/**
 * TreeShell source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.treeshell.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.treeshell.cli.TreeShellCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.treeshell.runtime.TreeShellRuntime} owns the active snapshot, dispatch and approvals.</li>
 *   <li>{@code io.treeshell.merge.ConfigMergeEngine} folds the system and user layers into one node graph.</li>
 *   <li>{@code io.treeshell.storage.WorkflowStore} is the authoritative workflow persistence layer.</li>
 * </ul>
 */
package io.treeshell;
