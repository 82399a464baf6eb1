/**
 * Service wiring and lifecycle.
 */
package com.mimecast.mailhealth.main;
