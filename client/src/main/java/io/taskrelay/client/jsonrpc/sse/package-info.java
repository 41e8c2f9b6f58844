@NullMarked
package io.taskrelay.client.jsonrpc.sse;

import org.jspecify.annotations.NullMarked;
