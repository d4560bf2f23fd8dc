/**
 * YAML rendering of definition models (Jackson {@code YAMLMapper}).
 */
package com.pipedef.definitions.serialization;
