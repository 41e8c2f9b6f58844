@NullMarked
package io.taskrelay.util;

import org.jspecify.annotations.NullMarked;
