/**
 * Satellite sessions: registry of live connections, routes from output topics to delivery
 * queues, and the accept/configure/teardown lifecycle.
 */
package com.phillippitts.groundstation.service.session;
