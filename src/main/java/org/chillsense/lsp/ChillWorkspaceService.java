package org.chillsense.lsp;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Workspace notifications are accepted and ignored; every document is analyzed on its own.
 */
public class ChillWorkspaceService implements WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(ChillWorkspaceService.class);

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        log.debug("Ignoring workspace configuration change");
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        log.debug("Ignoring {} watched file change(s)", params.getChanges().size());
    }
}
