/**
 * Discovery of definitions in a loaded module.
 * <ul>
 *   <li>{@link com.pipedef.publisher.discovery.DefinitionTypePredicate} – "is this type a definition" by ancestor name</li>
 *   <li>{@link com.pipedef.publisher.discovery.DefinitionDiscoverer} – instantiates every definition type</li>
 *   <li>{@link com.pipedef.publisher.discovery.DefinitionDescriptor} – capability surface used by the orchestrator</li>
 * </ul>
 */
package com.pipedef.publisher.discovery;
