/**
 * Demo frontend module.
 *
 * <p>Demonstrates the session service on a frontend server with in-memory
 * client connections.</p>
 */
module demo.frontend
{
    requires frontend.api;
    requires frontend.impl;
    requires org.slf4j;
}
