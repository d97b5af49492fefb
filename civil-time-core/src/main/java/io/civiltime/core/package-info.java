/**
 * Zone-independent civil date and time values.
 *
 * <p>This module is deliberately dependency-free. It contains only:
 * <ul>
 *   <li>The {@link io.civiltime.core.Date}, {@link io.civiltime.core.Time} and
 *       {@link io.civiltime.core.DateTime} value types</li>
 *   <li>Their strict text layouts and the {@link io.civiltime.core.TextCodec} pair</li>
 *   <li>The {@link io.civiltime.core.ScanInput} variant used by storage adapters</li>
 * </ul>
 *
 * <p>JSON and JDBC bindings live in other modules.
 */
package io.civiltime.core;
