@NullMarked
package io.taskrelay.server.events;

import org.jspecify.annotations.NullMarked;
