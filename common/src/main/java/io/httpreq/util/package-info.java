@NullMarked
package io.httpreq.util;

import org.jspecify.annotations.NullMarked;
