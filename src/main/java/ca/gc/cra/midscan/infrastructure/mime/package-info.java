/**
 * MIME helpers: encoded-word decoding and body previews.
 */
package ca.gc.cra.midscan.infrastructure.mime;
