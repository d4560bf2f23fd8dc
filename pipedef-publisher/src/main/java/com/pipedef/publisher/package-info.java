/**
 * Publisher: loads a compiled definitions module, publishes every definition and reports drift.
 * <ul>
 *   <li>{@link com.pipedef.publisher.PublishDefinitionsApplication} – command-line entry point</li>
 *   <li>{@link com.pipedef.publisher.PublisherConfig} – arguments and environment</li>
 *   <li>{@link com.pipedef.publisher.loader} – module loading</li>
 *   <li>{@link com.pipedef.publisher.discovery} – definition discovery</li>
 *   <li>{@link com.pipedef.publisher.change} – content fingerprints</li>
 *   <li>{@link com.pipedef.publisher.publish} – publish run and results</li>
 * </ul>
 */
package com.pipedef.publisher;
