@NullMarked
package io.taskrelay.client.jsonrpc;

import org.jspecify.annotations.NullMarked;
