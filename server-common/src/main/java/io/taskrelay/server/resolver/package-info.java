@NullMarked
package io.taskrelay.server.resolver;

import org.jspecify.annotations.NullMarked;
