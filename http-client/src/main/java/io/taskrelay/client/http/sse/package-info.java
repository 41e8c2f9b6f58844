@NullMarked
package io.taskrelay.client.http.sse;

import org.jspecify.annotations.NullMarked;
