package com.plangraph.core.parser;

import com.plangraph.core.model.EpicNode;
import com.plangraph.core.model.NodeFields;
import com.plangraph.core.model.NodeKind;
import com.plangraph.core.model.Plan;
import com.plangraph.core.model.Status;
import com.plangraph.core.model.StoryNode;
import com.plangraph.core.model.TaskNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a schema-valid plan DOM into the epic / story / task hierarchy.
 * <p>
 * Failures are local. An element with an empty id, an unknown status, a
 * non-numeric priority or points value, or an id already used earlier in the
 * document is dropped together with everything nested under it. Siblings and
 * ancestors are built as usual and nothing is thrown; the drops are listed in
 * the {@link ParseReport}.
 * <p>
 * An element's own fields are checked before its children are visited, so the
 * children of a rejected element are never inspected.
 */
@Component
public class PlanParser {

    private static final Logger log = LoggerFactory.getLogger(PlanParser.class);

    static final String DEFAULT_VERSION = "1.0";
    static final String DEFAULT_PRIORITY = "1";
    static final String DEFAULT_POINTS = "0";

    public ParsedPlan parse(Document document) {
        return new Run().parse(document.getDocumentElement());
    }

    /**
     * Mutable state of a single parse. Discarded afterwards.
     */
    private static final class Run {

        private final Set<String> claimedIds = new HashSet<>();
        private final List<DroppedElement> dropped = new ArrayList<>();
        private int seen;
        private int accepted;

        ParsedPlan parse(Element root) {
            String version = root.hasAttribute("version") ? root.getAttribute("version") : DEFAULT_VERSION;

            var epics = new ArrayList<EpicNode>();
            for (Element epicElem : children(root, "epic")) {
                parseEpic(epicElem).ifPresent(epics::add);
            }

            var report = new ParseReport(seen, accepted, dropped);
            log.debug("Parsed plan v{}: {} of {} elements accepted", version, accepted, seen);
            return new ParsedPlan(new Plan(version, epics), report);
        }

        private Optional<EpicNode> parseEpic(Element elem) {
            var fields = readFields(elem, NodeKind.EPIC);
            if (fields.isEmpty() || !claim(NodeKind.EPIC, fields.get().id())) {
                return Optional.empty();
            }

            var stories = new ArrayList<StoryNode>();
            for (Element storyElem : children(elem, "story")) {
                parseStory(storyElem).ifPresent(stories::add);
            }
            return Optional.of(new EpicNode(fields.get(), stories));
        }

        private Optional<StoryNode> parseStory(Element elem) {
            var fields = readFields(elem, NodeKind.STORY);
            if (fields.isEmpty()) {
                return Optional.empty();
            }
            String rawPoints = childText(elem, "points", DEFAULT_POINTS);
            Integer points = parseInt(rawPoints);
            if (points == null) {
                drop(NodeKind.STORY, fields.get().id(), DropReason.INVALID_POINTS, rawPoints);
                return Optional.empty();
            }
            if (!claim(NodeKind.STORY, fields.get().id())) {
                return Optional.empty();
            }

            var tasks = new ArrayList<TaskNode>();
            for (Element taskElem : children(elem, "task")) {
                parseTask(taskElem).ifPresent(tasks::add);
            }
            return Optional.of(new StoryNode(fields.get(), points, tasks));
        }

        private Optional<TaskNode> parseTask(Element elem) {
            var fields = readFields(elem, NodeKind.TASK);
            if (fields.isEmpty() || !claim(NodeKind.TASK, fields.get().id())) {
                return Optional.empty();
            }

            var dependsOn = new ArrayList<String>();
            NodeList deps = elem.getElementsByTagName("depends_on");
            for (int i = 0; i < deps.getLength(); i++) {
                String dep = deps.item(i).getTextContent().strip();
                if (!dep.isEmpty()) {
                    dependsOn.add(dep);
                }
            }
            return Optional.of(new TaskNode(fields.get(), dependsOn));
        }

        /**
         * Reads id, status, description and priority. Records a drop and
         * returns empty on the first failed check.
         */
        private Optional<NodeFields> readFields(Element elem, NodeKind level) {
            seen++;
            String id = elem.getAttribute("id").strip();
            if (id.isEmpty()) {
                drop(level, id, DropReason.EMPTY_ID, "");
                return Optional.empty();
            }

            String rawStatus = elem.getAttribute("status");
            Optional<Status> status = Status.fromValue(rawStatus);
            if (status.isEmpty()) {
                drop(level, id, DropReason.UNKNOWN_STATUS, rawStatus);
                return Optional.empty();
            }

            String rawPriority = childText(elem, "priority", DEFAULT_PRIORITY);
            Integer priority = parseInt(rawPriority);
            if (priority == null) {
                drop(level, id, DropReason.INVALID_PRIORITY, rawPriority);
                return Optional.empty();
            }

            String description = childText(elem, "description", "");
            return Optional.of(new NodeFields(id, description, status.get(), priority));
        }

        private boolean claim(NodeKind level, String id) {
            if (!claimedIds.add(id)) {
                drop(level, id, DropReason.DUPLICATE_ID, id);
                return false;
            }
            accepted++;
            return true;
        }

        private void drop(NodeKind level, String id, DropReason reason, String detail) {
            log.warn("Dropping {} '{}' from plan: {} ({})", level.name().toLowerCase(), id, reason, detail);
            dropped.add(new DroppedElement(level, id, reason, detail));
        }
    }

    private static Integer parseInt(String raw) {
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String childText(Element parent, String name, String defaultValue) {
        List<Element> matches = children(parent, name);
        if (matches.isEmpty()) {
            return defaultValue;
        }
        return matches.get(0).getTextContent().strip();
    }

    private static List<Element> children(Element parent, String name) {
        var result = new ArrayList<Element>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(child))) {
                result.add((Element) child);
            }
        }
        return result;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}
