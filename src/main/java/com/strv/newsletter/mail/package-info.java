/**
 * Mail transports.
 */
package com.strv.newsletter.mail;
