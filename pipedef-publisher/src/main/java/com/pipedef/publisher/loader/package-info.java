/**
 * Loading of compiled definitions modules.
 * <ul>
 *   <li>{@link com.pipedef.publisher.loader.DefinitionModuleLoader} – loads a module JAR and its sibling dependency JARs</li>
 *   <li>{@link com.pipedef.publisher.loader.SharedApiClassLoader} – parent loader exposing only shared packages</li>
 *   <li>{@link com.pipedef.publisher.loader.TypeCatalog} – types declared by the module, in JAR order</li>
 *   <li>{@link com.pipedef.publisher.loader.ModuleLoaderConfig} – required artifacts and shared packages</li>
 * </ul>
 */
package com.pipedef.publisher.loader;
