/**
 * HTTP ingress: inbound emails, Mattermost action callbacks and instance administration.
 */
package com.example.mailagent.controller;
