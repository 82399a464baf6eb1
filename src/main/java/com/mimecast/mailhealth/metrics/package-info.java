/**
 * Mail health metrics store and its Micrometer binding.
 */
package com.mimecast.mailhealth.metrics;
