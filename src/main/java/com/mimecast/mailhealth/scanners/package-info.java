/**
 * Spam score service clients.
 */
package com.mimecast.mailhealth.scanners;
