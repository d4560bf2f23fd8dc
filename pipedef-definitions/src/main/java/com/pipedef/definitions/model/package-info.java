/**
 * Pipeline model. Step kinds live in {@link com.pipedef.definitions.model.tasks}.
 */
package com.pipedef.definitions.model;
