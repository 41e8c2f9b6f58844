@NullMarked
package io.taskrelay.client.http;

import org.jspecify.annotations.NullMarked;
