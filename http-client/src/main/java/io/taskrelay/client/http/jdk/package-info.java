@NullMarked
package io.taskrelay.client.http.jdk;

import org.jspecify.annotations.NullMarked;
