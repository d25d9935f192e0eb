/**
 * Column-to-field mapping and operator decisions.
 */
package io.github.yok.forcelink.mapping;
