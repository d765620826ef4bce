/**
 * The transport-independent failure taxonomy and the per-transport tables
 * that translate native exceptions into it.
 */
package com.questrail.courier.exceptions;
