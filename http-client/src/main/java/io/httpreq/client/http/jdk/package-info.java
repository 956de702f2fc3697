@NullMarked
package io.httpreq.client.http.jdk;

import org.jspecify.annotations.NullMarked;
