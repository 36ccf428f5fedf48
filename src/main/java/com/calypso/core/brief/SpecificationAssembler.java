package com.calypso.core.brief;

import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.Framework;
import com.calypso.core.model.ProjectSpecification;
import com.calypso.core.model.StylingApproach;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns a project specification and its build configuration into the prompts for the
 * generation call.
 * <p>
 * The system prompt lists features, flows and pages, embeds page designs (stripped of the
 * visual editor's {@code data-bf-id} attributes), adds framework and dependency rules, and
 * fixes the {@code ===FILE:} output framing the extractor parses.
 */
@Component
public class SpecificationAssembler {

    static final String USER_PROMPT = "Generate the complete project now. Output ALL files using the "
            + "===FILE: path=== format. No explanation outside of file markers. The project MUST compile and "
            + "build successfully. Double-check every file for valid syntax, correct imports, and proper "
            + "configuration before outputting it. IMPORTANT: All npm packages must use their LATEST versions "
            + "that are compatible with React 19. Do NOT use outdated package versions. Include an .npmrc file "
            + "with legacy-peer-deps=true.";

    private static final Pattern BF_ID_ATTRIBUTE = Pattern.compile("\\s*data-bf-id=\"[^\"]*\"");

    private static final String NEXTJS_RULES = """

            - Use Next.js 15 (latest stable). In package.json: "next": "^15.1.0", "react": "^19.0.0", "react-dom": "^19.0.0"
            - Use Next.js App Router with server and client components
            - Config file MUST be named next.config.mjs (ESM, NOT .ts and NOT .js). Example:
              /** @type {import('next').NextConfig} */
              const nextConfig = {};
              export default nextConfig;
            - Every component that uses hooks (useState, useEffect, etc.), event handlers (onClick, onChange, etc.), or browser APIs MUST have "use client" at the top
            - Do NOT import from "next/router". Use "next/navigation" instead (useRouter, usePathname, useSearchParams)
            - For images, use next/image with width and height props, OR use regular <img> tags
            - Do NOT use the experimental "appDir" option. App Router is the default in Next.js 15""";

    private static final String VITE_RULES = """

            - Use Vite 6 with React 19. In package.json: "vite": "^6.0.0", "react": "^19.0.0", "react-dom": "^19.0.0", "@vitejs/plugin-react": "^4.3.0"
            - Config file: vite.config.%s""";

    private static final String TAILWIND_V4_RULES = """

            - Use Tailwind CSS v4. In package.json: "tailwindcss": "^4.0.0", "@tailwindcss/postcss": "^4.0.0"
            - postcss.config.mjs should use @tailwindcss/postcss plugin
            - In the global CSS file, use @import "tailwindcss" (Tailwind v4 syntax, NOT @tailwind directives)
            - Do NOT create a tailwind.config.js/ts file. Tailwind v4 uses CSS-based configuration
            - Configure Tailwind theme in CSS using @theme { } blocks in the global CSS file""";

    private static final String DEPENDENCY_RULES = """

            DEPENDENCY VERSION RULES (React 19 compatibility):
            - ALL npm packages must be compatible with React 19. Use the LATEST versions of every library.
            - lucide-react: use "^0.460.0" or later (NOT 0.263.x which only supports React 18)
            - framer-motion: use "^12.0.0" or later
            - @radix-ui/*: use the latest versions (all support React 19)
            - react-hook-form: use "^7.54.0" or later
            - @headlessui/react: use "^2.2.0" or later
            - react-icons: use "^5.4.0" or later
            - clsx: use "^2.1.0"
            - class-variance-authority: use "^0.7.1"
            - tailwind-merge: use "^2.6.0"
            - zod: use "^3.24.0"
            - Do NOT use any package version that has peer dependency requirements for react@"^16" or react@"^17" or react@"^18" only
            - When in doubt, use the LATEST stable version of any package. Never use old/outdated versions
            - Generate an .npmrc file with: legacy-peer-deps=true

            CRITICAL BUILD RULES:
            - Every JSX/TSX file must have valid syntax: no unclosed tags, no missing return statements
            - Every import must reference a file/package that exists in the project
            - package.json must include ALL dependencies used in source files
            - tsconfig.json must have correct paths and compiler options for the chosen framework
            - All config files must use the correct file extension and syntax for the framework version""";

    private final ObjectMapper objectMapper;

    public SpecificationAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Removes the visual editor's {@code data-bf-id} attributes from design markup.
     */
    public static String stripEditorIds(String html) {
        if (html == null) {
            return null;
        }
        return BF_ID_ATTRIBUTE.matcher(html).replaceAll("");
    }

    public String userPrompt() {
        return USER_PROMPT;
    }

    public String systemPrompt(ProjectSpecification spec, BuildConfiguration config) {
        Framework framework = config.framework();
        String frameworkLabel = framework.label();
        List<String> parts = new ArrayList<>();

        String header = "You are an expert full-stack developer. Generate a complete, production-ready "
                + frameworkLabel + " project based on the following specification.\n\nPROJECT: " + spec.name();
        if (spec.description() != null && !spec.description().isBlank()) {
            header += ": " + spec.description();
        }
        parts.add(header);

        if (!spec.features().isEmpty()) {
            parts.add("\nFEATURES:\n" + spec.features().stream()
                    .map(f -> "- " + f.title() + ": " + f.description())
                    .collect(Collectors.joining("\n")));
        }

        if (!spec.flows().isEmpty()) {
            parts.add("\nUSER FLOWS:\n" + spec.flows().stream()
                    .map(this::describeFlow)
                    .collect(Collectors.joining("\n\n")));
        }

        appendPages(spec, frameworkLabel, parts);

        ProjectSpecification.StyleGuide styleGuide = spec.styleGuide();
        if (styleGuide != null && styleGuide.html() != null && !styleGuide.html().isBlank()) {
            var sb = new StringBuilder("\nSTYLE GUIDE: Match the visual style of the style guide design across all pages.");
            if (styleGuide.fonts() != null) {
                sb.append("\nFonts: ").append(toJson(styleGuide.fonts()));
            }
            if (styleGuide.colors() != null) {
                sb.append("\nColors: ").append(toJson(styleGuide.colors()));
            }
            sb.append("\n```html\n").append(stripEditorIds(styleGuide.html())).append("\n```");
            parts.add(sb.toString());
        }

        parts.add(techStack(config));
        return String.join("\n", parts);
    }

    private String describeFlow(ProjectSpecification.Flow flow) {
        var steps = flow.steps();
        String lines = IntStream.range(0, steps.size())
                .mapToObj(i -> "  " + (i + 1) + ". " + steps.get(i).title() + ": " + steps.get(i).description())
                .collect(Collectors.joining("\n"));
        return "Flow: " + flow.title() + "\n" + lines;
    }

    private void appendPages(ProjectSpecification spec, String frameworkLabel, List<String> parts) {
        if (spec.pages().isEmpty()) {
            return;
        }
        parts.add("\nPAGES:");
        for (ProjectSpecification.Page page : spec.pages()) {
            var sb = new StringBuilder("\nPAGE: ").append(page.title());
            if (page.description() != null && !page.description().isBlank()) {
                sb.append("\nDescription: ").append(page.description());
            }
            if (!page.contents().isEmpty()) {
                sb.append("\nContent sections:\n").append(page.contents().stream()
                        .map(c -> "  - " + c.name() + ": " + c.description())
                        .collect(Collectors.joining("\n")));
            }
            parts.add(sb.toString());
        }

        List<ProjectSpecification.Page> designed = spec.pages().stream()
                .filter(p -> p.designHtml() != null && !p.designHtml().isBlank())
                .toList();
        if (!designed.isEmpty()) {
            parts.add("\nDESIGNS:\nThe following HTML designs should be converted into " + frameworkLabel
                    + " components while preserving the visual design exactly:");
            for (ProjectSpecification.Page page : designed) {
                parts.add("\nPAGE: " + page.title() + "\n```html\n" + stripEditorIds(page.designHtml()) + "\n```");
            }
        }

        List<String> undesigned = spec.pages().stream()
                .filter(p -> p.designHtml() == null || p.designHtml().isBlank())
                .map(ProjectSpecification.Page::title)
                .toList();
        if (!undesigned.isEmpty()) {
            parts.add("\nPages without designs (create a clean, professional design for these): "
                    + String.join(", ", undesigned));
        }
    }

    private String techStack(BuildConfiguration config) {
        Framework framework = config.framework();
        boolean ts = config.typeScriptEnabled();
        String ext = ts ? "tsx" : "jsx";

        String frameworkRules = switch (framework) {
            case NEXTJS -> NEXTJS_RULES;
            case VITE_REACT -> VITE_RULES.formatted(ts ? "ts" : "js");
            case HTML -> "";
        };

        String tailwindRules = "";
        if (config.styling() == StylingApproach.TAILWIND) {
            tailwindRules = framework == Framework.NEXTJS
                    ? TAILWIND_V4_RULES
                    : "\n- Configure Tailwind CSS properly with the project's color palette";
        }

        String configFiles = switch (framework) {
            case NEXTJS -> "next.config.mjs, tsconfig.json, postcss.config.mjs";
            case VITE_REACT -> "vite.config." + (ts ? "ts" : "js") + ", tsconfig.json";
            case HTML -> "index.html";
        };

        var sb = new StringBuilder()
                .append("\nTECH STACK:\n")
                .append("- Framework: ").append(framework.label()).append('\n')
                .append("- Styling: ").append(config.styling().label()).append('\n')
                .append("- TypeScript: ").append(ts ? "Yes" : "No").append("\n\n")
                .append("REQUIREMENTS:\n")
                .append("- Generate a complete project with proper file structure\n")
                .append("- Convert all HTML designs into proper ").append(framework.label()).append(" components\n")
                .append("- Preserve the exact visual design from the HTML (colors, fonts, spacing, layout)\n")
                .append("- Create proper routing/navigation between pages\n")
                .append("- Include realistic placeholder data\n");
        if (ts) {
            sb.append("- Add proper TypeScript types for all components and data\n");
        }
        sb.append("- Include a README.md with setup instructions\n")
                .append("- Include package.json with all required dependencies and correct version numbers\n")
                .append("- The project MUST build successfully with \"npm install && npm run build\" with no errors\n")
                .append("- Do NOT use deprecated APIs or outdated package versions")
                .append(frameworkRules)
                .append(tailwindRules)
                .append('\n')
                .append(DEPENDENCY_RULES)
                .append("\n\nOUTPUT FORMAT:\n")
                .append("Return your response as a series of files. For each file, use this exact format:\n\n")
                .append("===FILE: path/to/file.").append(ext).append("===\n")
                .append("file content here\n")
                .append("===END FILE===\n\n")
                .append("Generate ALL files needed for a complete, runnable project. Include config files (")
                .append(configFiles)
                .append("), package.json, README.md, and all source files.");
        return sb.toString();
    }

    private String toJson(Map<String, String> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return value.toString();
        }
    }
}
