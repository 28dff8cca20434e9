package com.project.image.editor.controller;

import com.project.image.editor.service.EditKind;
import com.project.image.editor.service.EditSession;
import com.project.image.editor.service.UploadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the editor page. Thin controller: fills the model and routes to the Thymeleaf view.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final EditSession editSession;

    public HomeController(EditSession editSession) {
        this.editSession = editSession;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving editor page");
        populate(model, editSession);
        return "index"; // templates/index.html
    }

    public static void populate(Model model, EditSession session) {
        model.addAttribute("state", session.view());
        model.addAttribute("editKinds", EditKind.values());
        model.addAttribute("supportedFormats", String.join(", ", UploadService.SUPPORTED_FORMATS));
    }
}
