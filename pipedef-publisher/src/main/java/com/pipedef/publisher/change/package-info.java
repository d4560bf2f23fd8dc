/**
 * Content fingerprints of published files, used to detect drift.
 */
package com.pipedef.publisher.change;
