@NullMarked
package io.taskrelay.client.http.jdk.sse;

import org.jspecify.annotations.NullMarked;
