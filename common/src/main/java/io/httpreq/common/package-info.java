/**
 * Exception types and error messages shared across httpreq modules.
 */
@NullMarked
package io.httpreq.common;

import org.jspecify.annotations.NullMarked;
