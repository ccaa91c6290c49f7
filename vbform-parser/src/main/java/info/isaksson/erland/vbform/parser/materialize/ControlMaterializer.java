package info.isaksson.erland.vbform.parser.materialize;

import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.Properties;
import info.isaksson.erland.vbform.model.PropertyGroup;
import info.isaksson.erland.vbform.model.controls.*;
import info.isaksson.erland.vbform.model.props.*;
import info.isaksson.erland.vbform.parser.FormErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns the raw properties collected for one control into a typed {@link ControlNode}.
 *
 * <p>Controls in the {@code VB} namespace map to their built-in {@link ControlKind} variant; each
 * starts from the defaults the VB6 IDE uses and takes every recognised property from the file.
 * Unrecognised keys are ignored. Controls in any other namespace become {@link ControlKind.Custom}
 * with their raw properties preserved. The result depends only on the input.</p>
 */
public final class ControlMaterializer {
    private static final Logger LOG = LoggerFactory.getLogger(ControlMaterializer.class);

    /** The namespace of built-in controls. */
    public static final String BUILTIN_NAMESPACE = "VB";

    /**
     * Variant tag for {@code namespace.kind}: {@link ControlKind.Type#CUSTOM} outside the built-in
     * namespace.
     *
     * @throws PropertyDecodeException {@link FormErrorKind#UNKNOWN_CONTROL_KIND} for a {@code VB.}
     *         kind that does not exist
     */
    public static ControlKind.Type resolveType(String namespace, String kind) throws PropertyDecodeException {
        if (!BUILTIN_NAMESPACE.equals(namespace)) return ControlKind.Type.CUSTOM;
        ControlKind.Type type = ControlKind.Type.fromVbName(kind);
        if (type == null) {
            throw new PropertyDecodeException(FormErrorKind.UNKNOWN_CONTROL_KIND, null,
                    "'" + namespace + "." + kind + "' is not a built-in control kind.");
        }
        return type;
    }

    /**
     * Whether a child of type {@code child} may be sealed inside a scope of type {@code parent}.
     * Menus nest in forms and in other menus; a menu accepts nothing else. Other controls need a
     * container.
     */
    public static boolean acceptsChild(ControlKind.Type parent, ControlKind.Type child) {
        if (child == ControlKind.Type.MENU) {
            return parent == ControlKind.Type.FORM || parent == ControlKind.Type.MDI_FORM
                    || parent == ControlKind.Type.MENU;
        }
        return parent != ControlKind.Type.MENU && parent.isContainer();
    }

    /**
     * Builds the node for a sealed control scope.
     *
     * @param children non-menu controls sealed inside the scope
     * @param menus menu controls sealed inside the scope
     */
    public ControlNode materialize(String namespace, String kind, String name, Properties properties,
                                   List<PropertyGroup> groups, List<ControlNode> children,
                                   List<ControlNode> menus) throws PropertyDecodeException {
        if (properties == null) throw new IllegalArgumentException("properties must not be null");
        ControlKind.Type type = resolveType(namespace, kind);
        PropertyReader r = new PropertyReader(properties);
        String tag = r.string("Tag", "");
        int index = r.integer("Index", 0);
        ControlKind controlKind = kindOf(type, namespace, kind, r, groups, children, menus);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Materialized {} {}.{} ({} properties, {} groups)", name, namespace, kind,
                    properties.size(), groups == null ? 0 : groups.size());
        }
        return new ControlNode(name, tag, index, controlKind);
    }

    private static ControlKind kindOf(ControlKind.Type type, String namespace, String kind, PropertyReader r,
                                      List<PropertyGroup> groups, List<ControlNode> children,
                                      List<ControlNode> menus) throws PropertyDecodeException {
        switch (type) {
            case FORM:
                return new ControlKind.Form(form(r), children, menus, groups);
            case MDI_FORM:
                return new ControlKind.MdiForm(mdiForm(r), children, menus, groups);
            case FRAME:
                return new ControlKind.Frame(frame(r), children, groups);
            case PICTURE_BOX:
                return new ControlKind.PictureBox(pictureBox(r), children, groups);
            case MENU:
                return new ControlKind.Menu(menu(r), menus, groups);
            case CHECK_BOX:
                return new ControlKind.CheckBox(checkBox(r), groups);
            case COMBO_BOX:
                return new ControlKind.ComboBox(comboBox(r), groups);
            case COMMAND_BUTTON:
                return new ControlKind.CommandButton(commandButton(r), groups);
            case DATA:
                return new ControlKind.Data(data(r), groups);
            case DIR_LIST_BOX:
                return new ControlKind.DirListBox(dirListBox(r), groups);
            case DRIVE_LIST_BOX:
                return new ControlKind.DriveListBox(driveListBox(r), groups);
            case FILE_LIST_BOX:
                return new ControlKind.FileListBox(fileListBox(r), groups);
            case IMAGE:
                return new ControlKind.Image(image(r), groups);
            case LABEL:
                return new ControlKind.Label(label(r), groups);
            case LINE:
                return new ControlKind.Line(line(r), groups);
            case LIST_BOX:
                return new ControlKind.ListBox(listBox(r), groups);
            case OLE:
                return new ControlKind.Ole(ole(r), groups);
            case OPTION_BUTTON:
                return new ControlKind.OptionButton(optionButton(r), groups);
            case H_SCROLL_BAR:
                return new ControlKind.HScrollBar(scrollBar(r), groups);
            case V_SCROLL_BAR:
                return new ControlKind.VScrollBar(scrollBar(r), groups);
            case SHAPE:
                return new ControlKind.Shape(shape(r), groups);
            case TEXT_BOX:
                return new ControlKind.TextBox(textBox(r), groups);
            case TIMER:
                return new ControlKind.Timer(timer(r), groups);
            case CUSTOM:
            default:
                return new ControlKind.Custom(namespace, kind, r.properties(), groups, children);
        }
    }

    static CheckBoxProperties checkBox(PropertyReader r) throws PropertyDecodeException {
        CheckBoxProperties.Builder p = new CheckBoxProperties.Builder();
        p.alignment = r.enumValue("Alignment", JustifyAlignment.class, p.alignment);
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.caption = r.string("Caption", p.caption);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.dataField = r.string("DataField", p.dataField);
        p.dataFormat = r.string("DataFormat", p.dataFormat);
        p.dataMember = r.string("DataMember", p.dataMember);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.disabledPicture = r.binary("DisabledPicture", p.disabledPicture);
        p.downPicture = r.binary("DownPicture", p.downPicture);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.height = r.integer("Height", p.height);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.left = r.integer("Left", p.left);
        p.maskColor = r.color("MaskColor", p.maskColor);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.picture = r.binary("Picture", p.picture);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.style = r.enumValue("Style", ButtonStyle.class, p.style);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.top = r.integer("Top", p.top);
        p.useMaskColor = r.enumValue("UseMaskColor", UseMaskColor.class, p.useMaskColor);
        p.value = r.enumValue("Value", CheckBoxValue.class, p.value);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static ComboBoxProperties comboBox(PropertyReader r) throws PropertyDecodeException {
        ComboBoxProperties.Builder p = new ComboBoxProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.dataField = r.string("DataField", p.dataField);
        p.dataFormat = r.string("DataFormat", p.dataFormat);
        p.dataMember = r.string("DataMember", p.dataMember);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.integralHeight = r.bool("IntegralHeight", p.integralHeight);
        p.locked = r.bool("Locked", p.locked);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDragMode = r.enumValue("OLEDragMode", OleDragMode.class, p.oleDragMode);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.sorted = r.bool("Sorted", p.sorted);
        p.style = r.enumValue("Style", ComboBoxStyle.class, p.style);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.text = r.string("Text", p.text);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        p.itemData = r.list("ItemData", p.itemData);
        p.list = r.list("List", p.list);
        return p.build();
    }

    static CommandButtonProperties commandButton(PropertyReader r) throws PropertyDecodeException {
        CommandButtonProperties.Builder p = new CommandButtonProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.cancel = r.bool("Cancel", p.cancel);
        p.caption = r.string("Caption", p.caption);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.defaultButton = r.bool("Default", p.defaultButton);
        p.disabledPicture = r.binary("DisabledPicture", p.disabledPicture);
        p.downPicture = r.binary("DownPicture", p.downPicture);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.maskColor = r.color("MaskColor", p.maskColor);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.picture = r.binary("Picture", p.picture);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.style = r.enumValue("Style", ButtonStyle.class, p.style);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.useMaskColor = r.enumValue("UseMaskColor", UseMaskColor.class, p.useMaskColor);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static DataProperties data(PropertyReader r) throws PropertyDecodeException {
        DataProperties.Builder p = new DataProperties.Builder();
        p.align = r.enumValue("Align", Align.class, p.align);
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.bofAction = r.enumValue("BOFAction", BofAction.class, p.bofAction);
        p.caption = r.string("Caption", p.caption);
        p.connection = r.textEnum("Connect", Connection.class, p.connection);
        p.databaseName = r.string("DatabaseName", p.databaseName);
        p.defaultCursorType = r.enumValue("DefaultCursorType", DefaultCursorType.class, p.defaultCursorType);
        p.defaultType = r.enumValue("DefaultType", DatabaseDriverType.class, p.defaultType);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.eofAction = r.enumValue("EOFAction", EofAction.class, p.eofAction);
        p.exclusive = r.bool("Exclusive", p.exclusive);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.negotiate = r.bool("Negotiate", p.negotiate);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.options = r.integer("Options", p.options);
        p.readOnly = r.bool("ReadOnly", p.readOnly);
        p.recordSetType = r.enumValue("RecordsetType", RecordSetType.class, p.recordSetType);
        p.recordSource = r.string("RecordSource", p.recordSource);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static DirListBoxProperties dirListBox(PropertyReader r) throws PropertyDecodeException {
        DirListBoxProperties.Builder p = new DirListBoxProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDragMode = r.enumValue("OLEDragMode", OleDragMode.class, p.oleDragMode);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static DriveListBoxProperties driveListBox(PropertyReader r) throws PropertyDecodeException {
        DriveListBoxProperties.Builder p = new DriveListBoxProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static FileListBoxProperties fileListBox(PropertyReader r) throws PropertyDecodeException {
        FileListBoxProperties.Builder p = new FileListBoxProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.archive = r.enumValue("Archive", FileAttributeFilter.class, p.archive);
        p.backColor = r.color("BackColor", p.backColor);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.hidden = r.enumValue("Hidden", FileAttributeFilter.class, p.hidden);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.multiSelect = r.enumValue("MultiSelect", MultiSelect.class, p.multiSelect);
        p.normal = r.enumValue("Normal", FileAttributeFilter.class, p.normal);
        p.oleDragMode = r.enumValue("OLEDragMode", OleDragMode.class, p.oleDragMode);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.pattern = r.string("Pattern", p.pattern);
        p.readOnly = r.enumValue("ReadOnly", FileAttributeFilter.class, p.readOnly);
        p.system = r.enumValue("System", FileAttributeFilter.class, p.system);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static FrameProperties frame(PropertyReader r) throws PropertyDecodeException {
        FrameProperties.Builder p = new FrameProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.borderStyle = r.enumValue("BorderStyle", BorderStyle.class, p.borderStyle);
        p.caption = r.string("Caption", p.caption);
        p.clipControls = r.enumValue("ClipControls", ClipControls.class, p.clipControls);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static ImageProperties image(PropertyReader r) throws PropertyDecodeException {
        ImageProperties.Builder p = new ImageProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.borderStyle = r.enumValue("BorderStyle", BorderStyle.class, p.borderStyle);
        p.dataField = r.string("DataField", p.dataField);
        p.dataFormat = r.string("DataFormat", p.dataFormat);
        p.dataMember = r.string("DataMember", p.dataMember);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDragMode = r.enumValue("OLEDragMode", OleDragMode.class, p.oleDragMode);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.picture = r.binary("Picture", p.picture);
        p.stretch = r.bool("Stretch", p.stretch);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static LabelProperties label(PropertyReader r) throws PropertyDecodeException {
        LabelProperties.Builder p = new LabelProperties.Builder();
        p.alignment = r.enumValue("Alignment", Alignment.class, p.alignment);
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.autoSize = r.enumValue("AutoSize", AutoSize.class, p.autoSize);
        p.backColor = r.color("BackColor", p.backColor);
        p.backStyle = r.enumValue("BackStyle", BackStyle.class, p.backStyle);
        p.borderStyle = r.enumValue("BorderStyle", BorderStyle.class, p.borderStyle);
        p.caption = r.string("Caption", p.caption);
        p.dataField = r.string("DataField", p.dataField);
        p.dataFormat = r.string("DataFormat", p.dataFormat);
        p.dataMember = r.string("DataMember", p.dataMember);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.linkItem = r.string("LinkItem", p.linkItem);
        p.linkMode = r.enumValue("LinkMode", LinkMode.class, p.linkMode);
        p.linkTimeout = r.integer("LinkTimeout", p.linkTimeout);
        p.linkTopic = r.string("LinkTopic", p.linkTopic);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.useMnemonic = r.bool("UseMnemonic", p.useMnemonic);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.wordWrap = r.enumValue("WordWrap", WordWrap.class, p.wordWrap);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static LineProperties line(PropertyReader r) throws PropertyDecodeException {
        LineProperties.Builder p = new LineProperties.Builder();
        p.borderColor = r.color("BorderColor", p.borderColor);
        p.borderStyle = r.enumValue("BorderStyle", DrawStyle.class, p.borderStyle);
        p.borderWidth = r.integer("BorderWidth", p.borderWidth);
        p.drawMode = r.enumValue("DrawMode", DrawMode.class, p.drawMode);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.x1 = r.integer("X1", p.x1);
        p.y1 = r.integer("Y1", p.y1);
        p.x2 = r.integer("X2", p.x2);
        p.y2 = r.integer("Y2", p.y2);
        return p.build();
    }

    static ListBoxProperties listBox(PropertyReader r) throws PropertyDecodeException {
        ListBoxProperties.Builder p = new ListBoxProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.columns = r.integer("Columns", p.columns);
        p.dataField = r.string("DataField", p.dataField);
        p.dataFormat = r.string("DataFormat", p.dataFormat);
        p.dataMember = r.string("DataMember", p.dataMember);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.integralHeight = r.bool("IntegralHeight", p.integralHeight);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.multiSelect = r.enumValue("MultiSelect", MultiSelect.class, p.multiSelect);
        p.oleDragMode = r.enumValue("OLEDragMode", OleDragMode.class, p.oleDragMode);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.sorted = r.bool("Sorted", p.sorted);
        p.style = r.enumValue("Style", ListBoxStyle.class, p.style);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        p.itemData = r.list("ItemData", p.itemData);
        p.list = r.list("List", p.list);
        return p.build();
    }

    static MenuProperties menu(PropertyReader r) throws PropertyDecodeException {
        MenuProperties.Builder p = new MenuProperties.Builder();
        p.caption = r.string("Caption", p.caption);
        p.checked = r.bool("Checked", p.checked);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.negotiatePosition = r.enumValue("NegotiatePosition", NegotiatePosition.class, p.negotiatePosition);
        p.shortcut = r.textEnum("Shortcut", MenuShortcut.class, p.shortcut);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.windowList = r.bool("WindowList", p.windowList);
        return p.build();
    }

    static OleProperties ole(PropertyReader r) throws PropertyDecodeException {
        OleProperties.Builder p = new OleProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.autoActivate = r.enumValue("AutoActivate", AutoActivate.class, p.autoActivate);
        p.autoVerbMenu = r.bool("AutoVerbMenu", p.autoVerbMenu);
        p.backColor = r.color("BackColor", p.backColor);
        p.backStyle = r.enumValue("BackStyle", BackStyle.class, p.backStyle);
        p.borderStyle = r.enumValue("BorderStyle", BorderStyle.class, p.borderStyle);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.oleClass = r.string("Class", p.oleClass);
        p.dataField = r.string("DataField", p.dataField);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.displayType = r.enumValue("DisplayType", DisplayType.class, p.displayType);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.hostName = r.string("HostName", p.hostName);
        p.miscFlags = r.integer("MiscFlags", p.miscFlags);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDropAllowed = r.bool("OLEDropAllowed", p.oleDropAllowed);
        p.oleTypeAllowed = r.enumValue("OLETypeAllowed", OleTypeAllowed.class, p.oleTypeAllowed);
        p.sizeMode = r.enumValue("SizeMode", SizeMode.class, p.sizeMode);
        p.sourceDoc = r.string("SourceDoc", p.sourceDoc);
        p.sourceItem = r.string("SourceItem", p.sourceItem);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.updateOptions = r.enumValue("UpdateOptions", UpdateOptions.class, p.updateOptions);
        p.verb = r.integer("Verb", p.verb);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static OptionButtonProperties optionButton(PropertyReader r) throws PropertyDecodeException {
        OptionButtonProperties.Builder p = new OptionButtonProperties.Builder();
        p.alignment = r.enumValue("Alignment", JustifyAlignment.class, p.alignment);
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.caption = r.string("Caption", p.caption);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.disabledPicture = r.binary("DisabledPicture", p.disabledPicture);
        p.downPicture = r.binary("DownPicture", p.downPicture);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.maskColor = r.color("MaskColor", p.maskColor);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.picture = r.binary("Picture", p.picture);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.style = r.enumValue("Style", ButtonStyle.class, p.style);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.useMaskColor = r.enumValue("UseMaskColor", UseMaskColor.class, p.useMaskColor);
        p.value = r.enumValue("Value", OptionButtonValue.class, p.value);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static PictureBoxProperties pictureBox(PropertyReader r) throws PropertyDecodeException {
        PictureBoxProperties.Builder p = new PictureBoxProperties.Builder();
        p.align = r.enumValue("Align", Align.class, p.align);
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.autoRedraw = r.enumValue("AutoRedraw", AutoRedraw.class, p.autoRedraw);
        p.autoSize = r.enumValue("AutoSize", AutoSize.class, p.autoSize);
        p.backColor = r.color("BackColor", p.backColor);
        p.borderStyle = r.enumValue("BorderStyle", BorderStyle.class, p.borderStyle);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.clipControls = r.enumValue("ClipControls", ClipControls.class, p.clipControls);
        p.dataField = r.string("DataField", p.dataField);
        p.dataFormat = r.string("DataFormat", p.dataFormat);
        p.dataMember = r.string("DataMember", p.dataMember);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.drawMode = r.enumValue("DrawMode", DrawMode.class, p.drawMode);
        p.drawStyle = r.enumValue("DrawStyle", DrawStyle.class, p.drawStyle);
        p.drawWidth = r.integer("DrawWidth", p.drawWidth);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.fillColor = r.color("FillColor", p.fillColor);
        p.fillStyle = r.enumValue("FillStyle", FillStyle.class, p.fillStyle);
        p.fontTransparent = r.enumValue("FontTransparent", FontTransparency.class, p.fontTransparent);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.hasDc = r.enumValue("HasDC", HasDeviceContext.class, p.hasDc);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.linkItem = r.string("LinkItem", p.linkItem);
        p.linkMode = r.enumValue("LinkMode", LinkMode.class, p.linkMode);
        p.linkTimeout = r.integer("LinkTimeout", p.linkTimeout);
        p.linkTopic = r.string("LinkTopic", p.linkTopic);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.negotiate = r.bool("Negotiate", p.negotiate);
        p.oleDragMode = r.enumValue("OLEDragMode", OleDragMode.class, p.oleDragMode);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.picture = r.binary("Picture", p.picture);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.scaleHeight = r.integer("ScaleHeight", p.scaleHeight);
        p.scaleLeft = r.integer("ScaleLeft", p.scaleLeft);
        p.scaleMode = r.enumValue("ScaleMode", ScaleMode.class, p.scaleMode);
        p.scaleTop = r.integer("ScaleTop", p.scaleTop);
        p.scaleWidth = r.integer("ScaleWidth", p.scaleWidth);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static ScrollBarProperties scrollBar(PropertyReader r) throws PropertyDecodeException {
        ScrollBarProperties.Builder p = new ScrollBarProperties.Builder();
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.largeChange = r.integer("LargeChange", p.largeChange);
        p.max = r.integer("Max", p.max);
        p.min = r.integer("Min", p.min);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.smallChange = r.integer("SmallChange", p.smallChange);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.value = r.integer("Value", p.value);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static ShapeProperties shape(PropertyReader r) throws PropertyDecodeException {
        ShapeProperties.Builder p = new ShapeProperties.Builder();
        p.backColor = r.color("BackColor", p.backColor);
        p.backStyle = r.enumValue("BackStyle", BackStyle.class, p.backStyle);
        p.borderColor = r.color("BorderColor", p.borderColor);
        p.borderStyle = r.enumValue("BorderStyle", DrawStyle.class, p.borderStyle);
        p.borderWidth = r.integer("BorderWidth", p.borderWidth);
        p.drawMode = r.enumValue("DrawMode", DrawMode.class, p.drawMode);
        p.fillColor = r.color("FillColor", p.fillColor);
        p.fillStyle = r.enumValue("FillStyle", DrawStyle.class, p.fillStyle);
        p.shape = r.enumValue("Shape", ShapeType.class, p.shape);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static TextBoxProperties textBox(PropertyReader r) throws PropertyDecodeException {
        TextBoxProperties.Builder p = new TextBoxProperties.Builder();
        p.alignment = r.enumValue("Alignment", Alignment.class, p.alignment);
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.backColor = r.color("BackColor", p.backColor);
        p.borderStyle = r.enumValue("BorderStyle", BorderStyle.class, p.borderStyle);
        p.causesValidation = r.enumValue("CausesValidation", CausesValidation.class, p.causesValidation);
        p.dataField = r.string("DataField", p.dataField);
        p.dataFormat = r.string("DataFormat", p.dataFormat);
        p.dataMember = r.string("DataMember", p.dataMember);
        p.dataSource = r.string("DataSource", p.dataSource);
        p.dragIcon = r.binary("DragIcon", p.dragIcon);
        p.dragMode = r.enumValue("DragMode", DragMode.class, p.dragMode);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.hideSelection = r.bool("HideSelection", p.hideSelection);
        p.linkItem = r.string("LinkItem", p.linkItem);
        p.linkMode = r.enumValue("LinkMode", LinkMode.class, p.linkMode);
        p.linkTimeout = r.integer("LinkTimeout", p.linkTimeout);
        p.linkTopic = r.string("LinkTopic", p.linkTopic);
        p.locked = r.bool("Locked", p.locked);
        p.maxLength = r.integer("MaxLength", p.maxLength);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.multiLine = r.enumValue("MultiLine", MultiLine.class, p.multiLine);
        p.oleDragMode = r.enumValue("OLEDragMode", OleDragMode.class, p.oleDragMode);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.passwordChar = r.character("PasswordChar", p.passwordChar);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.scrollBars = r.enumValue("ScrollBars", ScrollBars.class, p.scrollBars);
        p.tabIndex = r.integer("TabIndex", p.tabIndex);
        p.tabStop = r.enumValue("TabStop", TabStop.class, p.tabStop);
        p.text = r.string("Text", p.text);
        p.toolTipText = r.string("ToolTipText", p.toolTipText);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelpId = r.integer("WhatsThisHelpID", p.whatsThisHelpId);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static TimerProperties timer(PropertyReader r) throws PropertyDecodeException {
        TimerProperties.Builder p = new TimerProperties.Builder();
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.interval = r.integer("Interval", p.interval);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        return p.build();
    }

    static FormProperties form(PropertyReader r) throws PropertyDecodeException {
        FormProperties.Builder p = new FormProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.autoRedraw = r.enumValue("AutoRedraw", AutoRedraw.class, p.autoRedraw);
        p.backColor = r.color("BackColor", p.backColor);
        p.borderStyle = r.enumValue("BorderStyle", FormBorderStyle.class, p.borderStyle);
        p.caption = r.string("Caption", p.caption);
        p.clientHeight = r.integer("ClientHeight", p.clientHeight);
        p.clientLeft = r.integer("ClientLeft", p.clientLeft);
        p.clientTop = r.integer("ClientTop", p.clientTop);
        p.clientWidth = r.integer("ClientWidth", p.clientWidth);
        p.clipControls = r.enumValue("ClipControls", ClipControls.class, p.clipControls);
        p.controlBox = r.enumValue("ControlBox", TitleBarButton.class, p.controlBox);
        p.drawMode = r.enumValue("DrawMode", DrawMode.class, p.drawMode);
        p.drawStyle = r.enumValue("DrawStyle", DrawStyle.class, p.drawStyle);
        p.drawWidth = r.integer("DrawWidth", p.drawWidth);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.fillColor = r.color("FillColor", p.fillColor);
        p.fillStyle = r.enumValue("FillStyle", FillStyle.class, p.fillStyle);
        p.fontTransparent = r.enumValue("FontTransparent", FontTransparency.class, p.fontTransparent);
        p.foreColor = r.color("ForeColor", p.foreColor);
        p.hasDc = r.enumValue("HasDC", HasDeviceContext.class, p.hasDc);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.icon = r.binary("Icon", p.icon);
        p.keyPreview = r.bool("KeyPreview", p.keyPreview);
        p.linkMode = r.enumValue("LinkMode", FormLinkMode.class, p.linkMode);
        p.linkTopic = r.string("LinkTopic", p.linkTopic);
        p.maxButton = r.enumValue("MaxButton", TitleBarButton.class, p.maxButton);
        p.mdiChild = r.bool("MDIChild", p.mdiChild);
        p.minButton = r.enumValue("MinButton", TitleBarButton.class, p.minButton);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.moveable = r.enumValue("Moveable", Movability.class, p.moveable);
        p.negotiateMenus = r.bool("NegotiateMenus", p.negotiateMenus);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.palette = r.binary("Palette", p.palette);
        p.paletteMode = r.enumValue("PaletteMode", PaletteMode.class, p.paletteMode);
        p.picture = r.binary("Picture", p.picture);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.scaleHeight = r.integer("ScaleHeight", p.scaleHeight);
        p.scaleLeft = r.integer("ScaleLeft", p.scaleLeft);
        p.scaleMode = r.enumValue("ScaleMode", ScaleMode.class, p.scaleMode);
        p.scaleTop = r.integer("ScaleTop", p.scaleTop);
        p.scaleWidth = r.integer("ScaleWidth", p.scaleWidth);
        p.showInTaskbar = r.enumValue("ShowInTaskbar", ShowInTaskbar.class, p.showInTaskbar);
        p.startUpPosition = r.startUpPosition(p.startUpPosition);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisButton = r.enumValue("WhatsThisButton", WhatsThisButton.class, p.whatsThisButton);
        p.whatsThisHelp = r.enumValue("WhatsThisHelp", WhatsThisHelp.class, p.whatsThisHelp);
        p.windowState = r.enumValue("WindowState", WindowState.class, p.windowState);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }

    static MdiFormProperties mdiForm(PropertyReader r) throws PropertyDecodeException {
        MdiFormProperties.Builder p = new MdiFormProperties.Builder();
        p.appearance = r.enumValue("Appearance", Appearance.class, p.appearance);
        p.autoShowChildren = r.bool("AutoShowChildren", p.autoShowChildren);
        p.backColor = r.color("BackColor", p.backColor);
        p.caption = r.string("Caption", p.caption);
        p.enabled = r.enumValue("Enabled", Activation.class, p.enabled);
        p.helpContextId = r.integer("HelpContextID", p.helpContextId);
        p.icon = r.binary("Icon", p.icon);
        p.linkMode = r.enumValue("LinkMode", FormLinkMode.class, p.linkMode);
        p.linkTopic = r.string("LinkTopic", p.linkTopic);
        p.mouseIcon = r.binary("MouseIcon", p.mouseIcon);
        p.mousePointer = r.enumValue("MousePointer", MousePointer.class, p.mousePointer);
        p.moveable = r.enumValue("Moveable", Movability.class, p.moveable);
        p.negotiateToolbars = r.bool("NegotiateToolbars", p.negotiateToolbars);
        p.oleDropMode = r.enumValue("OLEDropMode", OleDropMode.class, p.oleDropMode);
        p.picture = r.binary("Picture", p.picture);
        p.rightToLeft = r.enumValue("RightToLeft", TextDirection.class, p.rightToLeft);
        p.scrollBars = r.bool("ScrollBars", p.scrollBars);
        p.startUpPosition = r.startUpPosition(p.startUpPosition);
        p.visible = r.enumValue("Visible", Visibility.class, p.visible);
        p.whatsThisHelp = r.enumValue("WhatsThisHelp", WhatsThisHelp.class, p.whatsThisHelp);
        p.windowState = r.enumValue("WindowState", WindowState.class, p.windowState);
        p.height = r.integer("Height", p.height);
        p.left = r.integer("Left", p.left);
        p.top = r.integer("Top", p.top);
        p.width = r.integer("Width", p.width);
        return p.build();
    }
}
